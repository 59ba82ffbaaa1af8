package com.eyelevel.docpipeline.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Technical detail of a failure, for diagnostics.
     */
    private final String errorDetails;

    public static <T> ApiResponse<T> success(final T data, final String message) {
        return ApiResponse.<T>builder()
                .response(data)
                .displayMessage(message)
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();
    }

    public static <T> ApiResponse<T> error(final String message) {
        return ApiResponse.<T>builder().displayMessage(message).showMessage(true).build();
    }

    public static <T> ApiResponse<T> error(final String message, final String errorDetails) {
        return ApiResponse.<T>builder().displayMessage(message).showMessage(true).errorDetails(errorDetails).build();
    }
}
