package com.example.storefront.infrastructure.security;

import com.example.storefront.config.CheckoutProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "ipn-secret";

    private WebhookSignatureVerifier verifier;

    @BeforeEach
    void setUp() {
        CheckoutProperties properties = new CheckoutProperties();
        properties.getProcessor().setIpnSecret(SECRET);
        verifier = new WebhookSignatureVerifier(properties);
    }

    @Test
    void canonicalFormSortsKeysAndDropsWhitespace() throws Exception {
        String canonical = verifier.canonicalize("{ \"payment_status\": \"finished\", \"actually_paid\": 0.00050000, "
                + "\"fee\": {\"currency\": \"btc\", \"amount\": 1} }");

        assertEquals("{\"actually_paid\":0.00050000,\"fee\":{\"amount\":1,\"currency\":\"btc\"},"
                + "\"payment_status\":\"finished\"}", canonical);
    }

    @Test
    void acceptsSignatureOverSortedBody() throws Exception {
        String body = "{\"payment_status\":\"finished\",\"payment_id\":\"5077125051\",\"actually_paid\":0.0005}";
        String signature = verifier.sign(verifier.canonicalize(body), SECRET);

        assertTrue(verifier.verify(body, signature));
        assertTrue(verifier.verify(body, signature.toUpperCase(Locale.ROOT)));
    }

    @Test
    void keyOrderDoesNotMatter() throws Exception {
        String sent = "{\"b\":2,\"a\":1}";
        String signature = verifier.sign(verifier.canonicalize("{\"a\":1,\"b\":2}"), SECRET);

        assertTrue(verifier.verify(sent, signature));
    }

    @Test
    void rejectsTamperedBody() throws Exception {
        String signature = verifier.sign(verifier.canonicalize("{\"actually_paid\":1}"), SECRET);

        assertFalse(verifier.verify("{\"actually_paid\":2}", signature));
    }

    @Test
    void rejectsMissingHeaderOrSecret() throws Exception {
        String body = "{\"actually_paid\":1}";
        assertFalse(verifier.verify(body, null));
        assertFalse(verifier.verify(body, " "));

        CheckoutProperties unconfigured = new CheckoutProperties();
        WebhookSignatureVerifier withoutSecret = new WebhookSignatureVerifier(unconfigured);
        assertFalse(withoutSecret.verify(body, verifier.sign(verifier.canonicalize(body), SECRET)));
    }

    @Test
    void rejectsNonJsonBody() {
        assertFalse(verifier.verify("not json", "abcd"));
    }
}
