package com.titiplex.frost.core.publish;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.titiplex.frost.core.model.FinalSignature;
import com.titiplex.frost.core.store.SqliteDatabase;
import com.titiplex.frost.support.MutableClock;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutboxPublicationAdapterTest {
    private static final String KEY = "02" + "7a".repeat(32);
    private static final FinalSignature SIG = new FinalSignature("03" + "5b".repeat(32), "1c".repeat(32));

    private SqliteDatabase db;
    private OutboxPublicationAdapter adapter;

    @BeforeEach
    void setUp() {
        db = new SqliteDatabase("jdbc:sqlite::memory:");
        adapter = new OutboxPublicationAdapter(db, new MutableClock(0), "wss://relay.example");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void eventCarriesSignatureTagsAndNip01Id() throws Exception {
        ObjectNode event = adapter.signedEvent("sess-1", SIG,
                "{\"kind\":1,\"content\":\"hi\",\"tags\":[],\"created_at\":1700000000}", KEY);

        assertThat(event.get("pubkey").asText()).isEqualTo("7a".repeat(32));
        assertThat(event.get("sig").asText()).isEqualTo(SIG.s());
        assertThat(event.get("tags").toString())
                .isEqualTo("[[\"nonce\",\"" + SIG.r() + "\"],[\"frost\",\"sess-1\"]]");

        String canonical = "[0,\"" + "7a".repeat(32) + "\",1700000000,1," + event.get("tags") + ",\"hi\"]";
        String expected = Hex.toHexString(MessageDigest.getInstance("SHA-256")
                .digest(canonical.getBytes(StandardCharsets.UTF_8)));
        assertThat(event.get("id").asText()).isEqualTo(expected);
    }

    @Test
    void malformedTemplatesAreRefused() {
        for (String bad : new String[]{null, " ", "not json", "[]", "{\"kind\":\"1\",\"content\":\"\",\"tags\":[],\"created_at\":1}",
                "{\"kind\":1,\"content\":\"\",\"created_at\":1}"}) {
            assertThatThrownBy(() -> adapter.publish("s", SIG, bad, KEY)).isInstanceOf(PublicationException.class);
        }
    }

    @Test
    void publishingTwiceKeepsOneOutboxRow() {
        String template = "{\"kind\":1,\"content\":\"hi\",\"tags\":[],\"created_at\":1700000000}";
        String first = adapter.publish("s", SIG, template, KEY);
        String second = adapter.publish("s", SIG, template, KEY);

        assertThat(second).isEqualTo(first);
        Integer rows = db.query(conn -> {
            try (var st = conn.createStatement(); var rs = st.executeQuery("SELECT COUNT(*) FROM frost_outbox")) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        });
        assertThat(rows).isEqualTo(1);
    }

    @Test
    void xOnlyAcceptsEveryKeyEncoding() {
        String x = "7a".repeat(32);
        assertThat(OutboxPublicationAdapter.xOnly(x)).isEqualTo(x);
        assertThat(OutboxPublicationAdapter.xOnly("03" + x)).isEqualTo(x);
        assertThat(OutboxPublicationAdapter.xOnly("04" + x + "00".repeat(32))).isEqualTo(x);
        assertThatThrownBy(() -> OutboxPublicationAdapter.xOnly("abcd")).isInstanceOf(PublicationException.class);
    }
}
