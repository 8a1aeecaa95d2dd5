package com.questrail.opcua.codec;

import com.questrail.opcua.types.StatusCode;
import com.questrail.opcua.types.StatusCodes;

/**
 * Indicates that a value could not be encoded or decoded.
 *
 * <p>The status code classifies the failure. Callers only need to tell apart:</p>
 * <ul>
 *   <li>{@code BadEncodingLimitsExceeded}: a configured length or nesting limit
 *       was hit (policy rejection)</li>
 *   <li>{@code BadDecodingError}: the input is truncated, malformed or
 *       inconsistent (corruption or attack)</li>
 *   <li>{@code BadEncodingError}: a value could not be written</li>
 *   <li>{@code BadNotSupported}: the requested format/variant combination
 *       does not exist</li>
 * </ul>
 *
 * <p>A decode that throws this exception produces no partial result.</p>
 */
public final class CodecException extends RuntimeException
{
    private final StatusCode statusCode;

    public CodecException(long statusCode, String message)
    {
        super(message);
        this.statusCode = StatusCode.of(statusCode);
    }

    public CodecException(long statusCode, String message, Throwable cause)
    {
        super(message, cause);
        this.statusCode = StatusCode.of(statusCode);
    }

    public static CodecException decodingError(String message)
    {
        return new CodecException(StatusCodes.BadDecodingError, message);
    }

    public static CodecException decodingError(String message, Throwable cause)
    {
        return new CodecException(StatusCodes.BadDecodingError, message, cause);
    }

    public static CodecException encodingError(String message)
    {
        return new CodecException(StatusCodes.BadEncodingError, message);
    }

    public static CodecException encodingError(String message, Throwable cause)
    {
        return new CodecException(StatusCodes.BadEncodingError, message, cause);
    }

    public static CodecException limitsExceeded(String message)
    {
        return new CodecException(StatusCodes.BadEncodingLimitsExceeded, message);
    }

    public static CodecException limitsExceeded(String message, Throwable cause)
    {
        return new CodecException(StatusCodes.BadEncodingLimitsExceeded, message, cause);
    }

    public static CodecException notSupported(String message)
    {
        return new CodecException(StatusCodes.BadNotSupported, message);
    }

    public StatusCode statusCode()
    {
        return statusCode;
    }

    public boolean isLimitsExceeded()
    {
        return statusCode.value() == StatusCodes.BadEncodingLimitsExceeded;
    }

    public boolean isDecodingError()
    {
        return statusCode.value() == StatusCodes.BadDecodingError;
    }
}
