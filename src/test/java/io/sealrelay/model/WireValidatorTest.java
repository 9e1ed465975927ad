package io.sealrelay.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.sealrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class WireValidatorTest {
    private static final String ENVELOPE = """
            {"version":1,"senderId":"alice","recipientId":"bob","sessionId":"alice::bob",
             "type":3,"body":"AAEC","timestamp":1700000000000}
            """;

    @Test
    void acceptsWellFormedEnvelope() {
        Envelope envelope = WireValidator.envelope(Jsons.readTree(ENVELOPE));
        Assertions.assertEquals("alice", envelope.senderId());
        Assertions.assertEquals(3, envelope.type());
        Assertions.assertEquals(1_700_000_000_000L, envelope.timestamp());
    }

    @Test
    void namesTheOffendingEnvelopeField() {
        assertRejected(ENVELOPE.replace("\"senderId\":\"alice\"", "\"senderId\":\"\""), "envelope.senderId must be a non-empty string");
        assertRejected(ENVELOPE.replace("\"body\":\"AAEC\"", "\"body\":\"not base64!\""), "envelope.body must be base64");
        assertRejected(ENVELOPE.replace("\"type\":3", "\"type\":\"3\""), "envelope.type must be an integer");
        assertRejected(ENVELOPE.replace("\"version\":1", "\"version\":0"), "envelope.version must be >= 1");
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> WireValidator.envelope(null));
        Assertions.assertEquals("envelope must be an object", e.getMessage());
    }

    @Test
    void bundleRequiresAllThreePreKeys() {
        String bundle = """
                {"id":"bob","deviceId":1,"registrationId":77,"identityKey":"aWQ=",
                 "signedPreKey":{"keyId":1,"publicKey":"cHVi","signature":"c2ln"},
                 "preKey":{"keyId":4,"publicKey":"cHVi"},
                 "kyberPreKey":{"keyId":1,"publicKey":"cHVi","signature":"c2ln"}}
                """;
        Bundle parsed = WireValidator.bundle(Jsons.readTree(bundle));
        Assertions.assertEquals(4, parsed.preKey().keyId());
        Assertions.assertEquals(77, parsed.registrationId());

        JsonNode missingKyber = Jsons.readTree(bundle.replace("\"kyberPreKey\"", "\"otherKey\""));
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> WireValidator.bundle(missingKyber));
        Assertions.assertEquals("bundle.kyberPreKey must be an object", e.getMessage());
    }

    @Test
    void identityIdMustBeNonEmptyString() {
        Assertions.assertEquals("alice", WireValidator.identityId(Jsons.readTree("{\"id\":\"alice\"}"), "id"));
        Assertions.assertThrows(ValidationException.class, () -> WireValidator.identityId(Jsons.readTree("{\"id\":5}"), "id"));
        Assertions.assertThrows(ValidationException.class, () -> WireValidator.identityId(Jsons.readTree("{}"), "to"));
    }

    private static void assertRejected(String json, String message) {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> WireValidator.envelope(Jsons.readTree(json)));
        Assertions.assertEquals(message, e.getMessage());
    }
}
