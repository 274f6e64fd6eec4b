package com.example.storefront.presentation.dto.common;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Response without a payload.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class OperationResponse extends BaseResponse {

    public static OperationResponse success(String message) {
        return OperationResponse.builder().status("SUCCESS").message(message).build();
    }

    public static OperationResponse failed(String errorCode, String message) {
        return OperationResponse.builder().status("FAILED").errorCode(errorCode).message(message).build();
    }
}
