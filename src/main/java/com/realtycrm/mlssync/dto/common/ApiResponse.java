package com.realtycrm.mlssync.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

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

    public static <T> ApiResponse<T> error(final String displayMessage) {
        return ApiResponse.<T>builder().displayMessage(displayMessage).showMessage(true).build();
    }

    /**
     * @param detail Machine-oriented detail, carried in the {@code response} member.
     */
    public static ApiResponse<Object> error(final String displayMessage, final Object detail) {
        return ApiResponse.builder().displayMessage(displayMessage).response(detail).showMessage(true).build();
    }
}
