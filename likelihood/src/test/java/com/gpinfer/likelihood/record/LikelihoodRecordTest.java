package com.gpinfer.likelihood.record;

import com.gpinfer.likelihood.Likelihood;
import com.gpinfer.likelihood.ProbitLikelihood;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

class LikelihoodRecordTest {

    private final Likelihood likelihood = new ProbitLikelihood();

    @Test
    void testAppendInitialisesRecord() {
        LikelihoodRecord record = likelihood.recordAppend(null, 0);
        assertNotNull(record);
        assertEquals("probit", record.getType());
        assertEquals(0, record.size());
    }

    @Test
    void testAppendStoresEmptyParameterVectors() {
        LikelihoodRecord record = likelihood.recordAppend(null, 0);
        LikelihoodRecord same = likelihood.recordAppend(record, 0);
        assertSame(record, same);
        assertEquals(1, record.size());

        likelihood.recordAppend(record, 3);
        assertEquals(4, record.size());
        for (int i = 0; i < record.size(); i++) {
            assertEquals(0, record.get(i).length);
        }
    }

    @Test
    void testAppendRejectsForeignRecords() {
        LikelihoodRecord other = new LikelihoodRecord("logit");
        assertThrows(IllegalArgumentException.class, () -> likelihood.recordAppend(other, 0));

        LikelihoodRecord record = likelihood.recordAppend(null, 0);
        assertThrows(IndexOutOfBoundsException.class, () -> likelihood.recordAppend(record, -1));
    }

    @Test
    void testJsonRoundTrip() {
        LikelihoodRecord record = likelihood.recordAppend(null, 0);
        likelihood.recordAppend(record, 0);
        likelihood.recordAppend(record, 1);

        String json = LikelihoodRecordCodec.toJson(record);
        assertTrue(json.contains("\"probit\""), json);

        LikelihoodRecord restored = LikelihoodRecordCodec.fromJson(json);
        assertEquals(record.getType(), restored.getType());
        assertEquals(record.size(), restored.size());
        assertEquals(0, restored.get(1).length);
    }

    @Test
    void testCodecNullsAndErrors() {
        assertNull(LikelihoodRecordCodec.toJson(null));
        assertNull(LikelihoodRecordCodec.fromJson(null));
        assertThrows(UncheckedIOException.class, () -> LikelihoodRecordCodec.fromJson("{\"type\":"));
    }
}
