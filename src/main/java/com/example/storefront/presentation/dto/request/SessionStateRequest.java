package com.example.storefront.presentation.dto.request;

import com.example.storefront.application.session.BuyerSessionState;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Menu navigation from the chat front end.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionStateRequest {

    @NotNull(message = "state is required")
    private BuyerSessionState state;
}
