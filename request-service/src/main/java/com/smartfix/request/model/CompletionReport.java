package com.smartfix.request.model;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompletionReport {

    @Size(max = 1000)
    private String notes;

    @Builder.Default
    private List<String> images = new ArrayList<>();
}
