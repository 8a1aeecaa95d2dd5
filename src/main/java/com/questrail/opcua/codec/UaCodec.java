package com.questrail.opcua.codec;

import com.questrail.opcua.codec.binary.BinaryDecoder;
import com.questrail.opcua.codec.binary.BinaryEncoder;
import com.questrail.opcua.codec.json.JsonDecoder;
import com.questrail.opcua.codec.json.JsonEncoder;
import com.questrail.opcua.codec.json.JsonEncodingPolicy;
import com.questrail.opcua.codec.json.JsonEncodingType;
import com.questrail.opcua.codec.xml.XmlDecoder;
import com.questrail.opcua.codec.xml.XmlEncoder;
import com.questrail.opcua.observability.CodecErrorEvent;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * UaCodec
 * -----------------------------------------------------------------------------
 * Entry points for encoding and decoding whole messages.
 *
 * <p>A message is one structured value preceded by its type id:</p>
 * <ul>
 *   <li>binary: the binary encoding NodeId followed by the body</li>
 *   <li>XML: a root {@code <ExtensionObject>} element</li>
 *   <li>JSON: a root extension object</li>
 * </ul>
 *
 * <p>Failures are reported to the context's observability sink and then
 * rethrown as {@link CodecException}. A failed decode never returns a partial
 * value.</p>
 */
public final class UaCodec
{
    private UaCodec() {}

    public static byte[] encode(Encodeable value, EncodingContext context, EncodingFormat format)
    {
        return encode(value, context, format, JsonEncodingType.REVERSIBLE);
    }

    /**
     * @throws CodecException {@code BadNotSupported} when a JSON variant other
     *         than Reversible is asked of the binary or XML format
     */
    public static byte[] encode(Encodeable value, EncodingContext context, EncodingFormat format,
                                JsonEncodingType jsonType)
    {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(jsonType, "jsonType");

        return guarded("encode", format, context, () -> {
            requireReversible(format, jsonType);
            switch (format) {
                case BINARY: {
                    BinaryEncoder encoder = new BinaryEncoder(context);
                    try {
                        encoder.writeMessage(value);
                        return encoder.toByteArray();
                    }
                    finally {
                        encoder.close();
                    }
                }
                case XML: {
                    XmlEncoder encoder = new XmlEncoder(context);
                    encoder.writeMessage(value);
                    return encoder.toByteArray();
                }
                default: {
                    JsonEncoder encoder = new JsonEncoder(context, JsonEncodingPolicy.forType(jsonType));
                    encoder.writeMessage(value);
                    return encoder.toByteArray();
                }
            }
        });
    }

    /**
     * JSON encoding with a caller-tuned policy, e.g. Reversible with default
     * values included.
     */
    public static byte[] encodeJson(Encodeable value, EncodingContext context, JsonEncodingPolicy policy)
    {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(policy, "policy");

        return guarded("encode", EncodingFormat.JSON, context, () -> {
            JsonEncoder encoder = new JsonEncoder(context, policy);
            encoder.writeMessage(value);
            return encoder.toByteArray();
        });
    }

    public static Encodeable decode(byte[] bytes, EncodingContext context, EncodingFormat format)
    {
        return decodeMessage(bytes, context, format, JsonEncodingType.REVERSIBLE, null);
    }

    /**
     * @throws CodecException {@code BadDecodingError} if the message holds
     *         another type than {@code type}
     */
    public static <T extends Encodeable> T decode(byte[] bytes, EncodingContext context, EncodingFormat format,
                                                  EncodeableType<T> type)
    {
        Objects.requireNonNull(type, "type");
        return type.javaType().cast(decodeMessage(bytes, context, format, JsonEncodingType.REVERSIBLE, type));
    }

    /**
     * @throws CodecException {@code BadNotSupported} for
     *         {@link JsonEncodingType#NON_REVERSIBLE}
     */
    public static Encodeable decodeJson(byte[] bytes, EncodingContext context, JsonEncodingType jsonType)
    {
        Objects.requireNonNull(jsonType, "jsonType");
        return decodeMessage(bytes, context, EncodingFormat.JSON, jsonType, null);
    }

    private static Encodeable decodeMessage(byte[] bytes, EncodingContext context, EncodingFormat format,
                                            JsonEncodingType jsonType, EncodeableType<?> expected)
    {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(format, "format");

        return guarded("decode", format, context, () -> {
            switch (format) {
                case BINARY:
                    return new BinaryDecoder(bytes, context).readMessage(expected);
                case XML:
                    return new XmlDecoder(bytes, context).readMessage(expected);
                default:
                    return new JsonDecoder(bytes, context, jsonType).readMessage(expected);
            }
        });
    }

    private static void requireReversible(EncodingFormat format, JsonEncodingType jsonType)
    {
        if (format != EncodingFormat.JSON && jsonType != JsonEncodingType.REVERSIBLE) {
            throw CodecException.notSupported(format + " has no " + jsonType + " variant");
        }
    }

    private static <R> R guarded(String operation, EncodingFormat format, EncodingContext context,
                                 Supplier<R> body)
    {
        try {
            return body.get();
        }
        catch (CodecException e) {
            report(operation, format, context, e);
            throw e;
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            // value invariants rejecting decoded or caller-supplied content
            CodecException wrapped = "decode".equals(operation)
                    ? CodecException.decodingError(e.getMessage(), e)
                    : CodecException.encodingError(e.getMessage(), e);
            report(operation, format, context, wrapped);
            throw wrapped;
        }
    }

    private static void report(String operation, EncodingFormat format, EncodingContext context, CodecException e)
    {
        context.observabilitySink().onError(new CodecErrorEvent(
                Instant.now(),
                operation,
                format.name(),
                e.statusCode().symbol().orElse(e.statusCode().toString()),
                e.getMessage(),
                e.getCause()));
    }
}
