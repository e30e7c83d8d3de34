package com.enms.analytics.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAnomalyRequest {

    @Size(max = 500, message = "Note must be at most 500 characters")
    private String note;
}
