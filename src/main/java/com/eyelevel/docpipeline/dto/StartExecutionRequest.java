package com.eyelevel.docpipeline.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Identity of the document to process.")
public class StartExecutionRequest {

    @NotBlank(message = "The 'container' must not be blank.")
    @Schema(description = "Bucket holding the document.", example = "docs")
    private String container;

    @NotBlank(message = "The 'key' must not be blank.")
    @Schema(description = "Object key of the document.", example = "a.pdf")
    private String key;
}
