package com.example.storefront.presentation.dto.response;

import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class ReservationResponse extends BaseResponse {

    private Long buyerId;
    private Long productId;
    private Instant reservedAt;
    private Long remainingSeconds;

    public static ReservationResponse failed(Long buyerId, String errorCode, String message) {
        return ReservationResponse.builder()
                .status("FAILED")
                .buyerId(buyerId)
                .errorCode(errorCode)
                .message(message)
                .build();
    }
}
