package com.jay.proforma.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.jay.proforma.model.enums.CalculationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a calculation run at the API boundary. On failure {@code result} is absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalculationResponse {

    private CalculationStatus status;
    private List<String> errors;
    private List<String> warnings;
    private ProFormaResult result;

    public static CalculationResponse success(ProFormaResult result) {
        return CalculationResponse.builder()
            .status(CalculationStatus.SUCCESS)
            .errors(List.of())
            .warnings(result.getWarnings())
            .result(result)
            .build();
    }

    public static CalculationResponse failure(CalculationStatus status, List<String> errors) {
        return CalculationResponse.builder()
            .status(status)
            .errors(errors)
            .build();
    }

    public boolean isSuccess() {
        return status == CalculationStatus.SUCCESS;
    }
}
