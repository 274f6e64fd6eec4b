package com.example.storefront.application.session;

import lombok.Value;

/**
 * Text sent back for a free-text message, and the state the buyer is left in.
 */
@Value
public class BuyerReply {
    boolean handled;
    BuyerSessionState state;
    String text;
}
