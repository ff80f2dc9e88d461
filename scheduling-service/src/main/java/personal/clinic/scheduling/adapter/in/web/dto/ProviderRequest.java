package personal.clinic.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import personal.clinic.scheduling.application.port.in.RegisterProviderCommand;

import java.util.List;

/**
 * 의사 등록/수정 요청 DTO
 */
public record ProviderRequest(
        @NotBlank(message = "이름은 필수입니다.")
        String name,

        @NotBlank(message = "면허번호는 필수입니다.")
        String licenseCode,

        String specialty,
        List<String> availableSlots
) {
    public RegisterProviderCommand toCommand() {
        return new RegisterProviderCommand(name, licenseCode, specialty, availableSlots);
    }
}
