package com.example.storefront.application.session;

import com.example.storefront.application.service.BuyerAccountService;
import com.example.storefront.application.service.CheckoutService;
import com.example.storefront.config.CheckoutProperties;
import com.example.storefront.domain.exception.BasketEmptyException;
import com.example.storefront.domain.exception.BuyerNotFoundException;
import com.example.storefront.domain.exception.DiscountException;
import com.example.storefront.domain.model.discount.DiscountResolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Routes a free-text buyer message to the handler of the buyer's current session state.
 */
@Component
@Slf4j
public class BuyerMessageDispatcher {

    @FunctionalInterface
    interface MessageHandler {
        BuyerReply handle(BuyerSession session, String text);
    }

    private final CheckoutService checkoutService;
    private final BuyerAccountService buyerAccountService;
    private final BuyerSessionStore sessionStore;
    private final CheckoutProperties properties;
    private final Map<BuyerSessionState, MessageHandler> handlers = new EnumMap<>(BuyerSessionState.class);

    public BuyerMessageDispatcher(CheckoutService checkoutService,
                                  BuyerAccountService buyerAccountService,
                                  BuyerSessionStore sessionStore,
                                  CheckoutProperties properties) {
        this.checkoutService = checkoutService;
        this.buyerAccountService = buyerAccountService;
        this.sessionStore = sessionStore;
        this.properties = properties;
        for (BuyerSessionState state : BuyerSessionState.values()) {
            handlers.put(state, handlerFor(state));
        }
    }

    /**
     * @throws BuyerNotFoundException when the buyer never registered; no session is created for them
     */
    public BuyerReply dispatch(Long buyerId, String text) {
        buyerAccountService.getBuyer(buyerId);
        BuyerSession session = sessionStore.load(buyerId);
        BuyerSessionState state = session.getState();
        log.debug("Dispatching buyer message: buyerId={}, state={}", buyerId, state);
        return handlers.get(state).handle(session, text == null ? "" : text.trim());
    }

    private MessageHandler handlerFor(BuyerSessionState state) {
        return switch (state) {
            case BROWSING -> this::handleBrowsing;
            case AWAITING_BASKET_DISCOUNT_CODE -> this::handleDiscountCode;
            case AWAITING_TOP_UP_AMOUNT -> this::handleTopUpAmount;
        };
    }

    private BuyerReply handleBrowsing(BuyerSession session, String text) {
        return new BuyerReply(false, session.getState(), "Please use the menu buttons.");
    }

    private BuyerReply handleDiscountCode(BuyerSession session, String text) {
        if (text.isEmpty()) {
            BuyerSession saved = sessionStore.save(session.withState(BuyerSessionState.BROWSING));
            return new BuyerReply(true, saved.getState(), "No code entered.");
        }
        String currency = properties.getSettlement().getCurrency();
        try {
            DiscountResolution resolution = checkoutService.applyDiscount(session.getBuyerId(), text);
            return new BuyerReply(true, currentState(session), "Code " + resolution.getCode() + " applied: -"
                    + resolution.getDiscountAmount() + " " + currency + ". New total: "
                    + resolution.getFinalTotal() + " " + currency + ".");
        } catch (DiscountException e) {
            return new BuyerReply(true, currentState(session), "Code " + text + " cannot be used: "
                    + describe(e) + ".");
        } catch (BasketEmptyException e) {
            return new BuyerReply(true, currentState(session), "Your basket is empty.");
        }
    }

    private BuyerReply handleTopUpAmount(BuyerSession session, String text) {
        BigDecimal amount;
        try {
            amount = new BigDecimal(text.replace(',', '.'));
        } catch (NumberFormatException e) {
            return new BuyerReply(true, session.getState(), "Please enter a number, for example 25.50.");
        }

        BigDecimal minimum = properties.getSettlement().getMinTopUpAmount();
        String currency = properties.getSettlement().getCurrency();
        if (amount.compareTo(minimum) < 0) {
            return new BuyerReply(true, session.getState(), "The minimum top-up is " + minimum + " " + currency + ".");
        }

        BuyerSession saved = sessionStore.save(session.toBuilder()
                .pendingTopUpAmount(amount)
                .state(BuyerSessionState.BROWSING)
                .build());
        return new BuyerReply(true, saved.getState(), "Top-up of " + amount + " " + currency
                + ". Choose a payment asset: " + String.join(", ", properties.getSettlement().getSupportedAssets()) + ".");
    }

    private BuyerSessionState currentState(BuyerSession session) {
        return sessionStore.load(session.getBuyerId()).getState();
    }

    private static String describe(DiscountException e) {
        return switch (e.getRejection()) {
            case NOT_FOUND -> "code not found";
            case INACTIVE -> "code is not active";
            case EXPIRED -> "code has expired";
            case USAGE_LIMIT_REACHED -> "code has reached its usage limit";
        };
    }
}
