package com.questrail.opcua.codec;

import com.questrail.opcua.codec.json.JsonEncodingType;
import com.questrail.opcua.test.SampleStructure;
import com.questrail.opcua.test.TestContexts;
import com.questrail.opcua.test.VariantHolder;
import com.questrail.opcua.types.BuiltInType;
import com.questrail.opcua.types.Matrix;
import com.questrail.opcua.types.StatusCodes;
import com.questrail.opcua.types.Variant;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HostileInputTest
 * -----------------------------------------------------------------------------
 * Damaged messages either decode or fail with a {@link CodecException}.
 *
 * <p>Valid messages are corrupted with a fixed seed (flipped bytes, cuts,
 * inserted and repeated runs), so a failure always reproduces. Any other
 * exception or error thrown by a decoder fails the test.</p>
 */
final class HostileInputTest
{
    private static final int MUTATIONS = 400;

    @ParameterizedTest
    @EnumSource(EncodingFormat.class)
    void damagedSampleStructureFailsCleanly(EncodingFormat format)
    {
        byte[] valid = UaCodec.encode(SampleStructure.populated(), TestContexts.context(), format);

        assertTimeoutPreemptively(Duration.ofSeconds(60), () -> mutateAndDecode(valid, format, 17L));
    }

    @ParameterizedTest
    @EnumSource(EncodingFormat.class)
    void damagedNestedVariantFailsCleanly(EncodingFormat format)
    {
        Variant inner = Variant.ofMatrix(new Matrix(BuiltInType.VARIANT,
                new Object[] { Variant.ofInt32(1), Variant.ofString("two"), Variant.ofDouble(3), Variant.ofUInt32(4L) },
                new int[] { 2, 2 }));
        VariantHolder holder = new VariantHolder(
                Variant.ofArray(BuiltInType.VARIANT, new Object[] { inner, Variant.ofBoolean(true) }));
        byte[] valid = UaCodec.encode(holder, TestContexts.context(), format);

        assertTimeoutPreemptively(Duration.ofSeconds(60), () -> mutateAndDecode(valid, format, 29L));
    }

    @ParameterizedTest
    @EnumSource(value = JsonEncodingType.class, names = { "COMPACT", "VERBOSE" })
    void damagedJsonVariantsFailCleanly(JsonEncodingType jsonType)
    {
        byte[] valid = UaCodec.encode(SampleStructure.populated(), TestContexts.context(),
                EncodingFormat.JSON, jsonType);
        Random random = new Random(41L);

        assertTimeoutPreemptively(Duration.ofSeconds(60), () -> {
            for (int i = 0; i < MUTATIONS; i++) {
                byte[] damaged = mutate(valid, random);
                try {
                    UaCodec.decodeJson(damaged, TestContexts.context(), jsonType);
                }
                catch (CodecException e) {
                    assertNotNull(e.statusCode());
                }
            }
        });
    }

    private static void mutateAndDecode(byte[] valid, EncodingFormat format, long seed)
    {
        Random random = new Random(seed);
        for (int i = 0; i < MUTATIONS; i++) {
            byte[] damaged = mutate(valid, random);
            try {
                UaCodec.decode(damaged, TestContexts.context(), format);
            }
            catch (CodecException e) {
                assertTrue(e.isDecodingError() || e.isLimitsExceeded()
                                || e.statusCode().value() == StatusCodes.BadNotSupported,
                        format + " mutation " + i + ": " + e.statusCode());
            }
        }
    }

    private static byte[] mutate(byte[] valid, Random random)
    {
        byte[] bytes = valid.clone();
        int edits = 1 + random.nextInt(4);
        for (int e = 0; e < edits && bytes.length > 0; e++) {
            int at = random.nextInt(bytes.length);
            switch (random.nextInt(5)) {
                case 0:
                    bytes[at] ^= (byte) (1 << random.nextInt(8));
                    break;
                case 1:
                    bytes[at] = (byte) random.nextInt(256);
                    break;
                case 2:
                    bytes = Arrays.copyOf(bytes, at);
                    break;
                case 3: {
                    byte[] inserted = new byte[1 + random.nextInt(8)];
                    random.nextBytes(inserted);
                    bytes = splice(bytes, at, inserted);
                    break;
                }
                default: {
                    int length = Math.min(bytes.length - at, 1 + random.nextInt(16));
                    bytes = splice(bytes, at, Arrays.copyOfRange(bytes, at, at + length));
                    break;
                }
            }
        }
        return bytes;
    }

    private static byte[] splice(byte[] bytes, int at, byte[] inserted)
    {
        byte[] result = new byte[bytes.length + inserted.length];
        System.arraycopy(bytes, 0, result, 0, at);
        System.arraycopy(inserted, 0, result, at, inserted.length);
        System.arraycopy(bytes, at, result, at + inserted.length, bytes.length - at);
        return result;
    }
}
