package personal.clinic.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.clinic.scheduling.application.port.in.RegisterPatientCommand;

/**
 * 환자 등록/수정 요청 DTO
 */
public record PatientRequest(
        @NotBlank(message = "이름은 필수입니다.")
        String name,

        @NotBlank(message = "주민번호는 필수입니다.")
        String nationalId,

        String phone,
        String email
) {
    public RegisterPatientCommand toCommand() {
        return new RegisterPatientCommand(name, nationalId, phone, email);
    }
}
