package com.example.storefront.presentation.dto.response;

import com.example.storefront.application.session.BuyerReply;
import com.example.storefront.application.session.BuyerSessionState;
import com.example.storefront.presentation.dto.common.BaseResponse;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

@Data
@EqualsAndHashCode(callSuper = true)
@SuperBuilder
@NoArgsConstructor
public class MessageReplyResponse extends BaseResponse {

    private Boolean handled;
    private BuyerSessionState state;
    private String reply;

    public static MessageReplyResponse from(BuyerReply reply) {
        return MessageReplyResponse.builder()
                .status("SUCCESS")
                .handled(reply.isHandled())
                .state(reply.getState())
                .reply(reply.getText())
                .build();
    }
}
