package com.questrail.opcua.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Standard OPC UA status code values (code bits only, info bits zero).
 *
 * <p>Constant names follow the symbolic names published with the standard so
 * that they can be used verbatim as the {@code Symbol} field of the verbose
 * JSON encodings.</p>
 */
@SuppressWarnings("unused")
public final class StatusCodes
{
    public static final long Good = 0x0000_0000L;
    public static final long Uncertain = 0x4000_0000L;
    public static final long Bad = 0x8000_0000L;

    public static final long BadUnexpectedError = 0x8001_0000L;
    public static final long BadInternalError = 0x8002_0000L;
    public static final long BadOutOfMemory = 0x8003_0000L;
    public static final long BadResourceUnavailable = 0x8004_0000L;
    public static final long BadCommunicationError = 0x8005_0000L;
    public static final long BadEncodingError = 0x8006_0000L;
    public static final long BadDecodingError = 0x8007_0000L;
    public static final long BadEncodingLimitsExceeded = 0x8008_0000L;
    public static final long BadUnknownResponse = 0x8009_0000L;
    public static final long BadTimeout = 0x800A_0000L;
    public static final long BadServiceUnsupported = 0x800B_0000L;
    public static final long BadShutdown = 0x800C_0000L;
    public static final long BadServerNotConnected = 0x800D_0000L;
    public static final long BadServerHalted = 0x800E_0000L;
    public static final long BadNothingToDo = 0x800F_0000L;
    public static final long BadTooManyOperations = 0x8010_0000L;
    public static final long BadDataTypeIdUnknown = 0x8011_0000L;
    public static final long BadCertificateInvalid = 0x8012_0000L;
    public static final long BadSecurityChecksFailed = 0x8013_0000L;
    public static final long BadNoCommunication = 0x8031_0000L;
    public static final long BadWaitingForInitialData = 0x8032_0000L;
    public static final long BadNodeIdInvalid = 0x8033_0000L;
    public static final long BadNodeIdUnknown = 0x8034_0000L;
    public static final long BadAttributeIdInvalid = 0x8035_0000L;
    public static final long BadIndexRangeInvalid = 0x8036_0000L;
    public static final long BadIndexRangeNoData = 0x8037_0000L;
    public static final long BadDataEncodingInvalid = 0x8038_0000L;
    public static final long BadDataEncodingUnsupported = 0x8039_0000L;
    public static final long BadNotReadable = 0x803A_0000L;
    public static final long BadNotWritable = 0x803B_0000L;
    public static final long BadOutOfRange = 0x803C_0000L;
    public static final long BadNotSupported = 0x803D_0000L;
    public static final long BadNotFound = 0x803E_0000L;
    public static final long BadObjectDeleted = 0x803F_0000L;
    public static final long BadNotImplemented = 0x8040_0000L;
    public static final long BadTypeMismatch = 0x8074_0000L;
    public static final long BadConfigurationError = 0x8089_0000L;
    public static final long BadNotConnected = 0x808A_0000L;
    public static final long BadDeviceFailure = 0x808B_0000L;
    public static final long BadSensorFailure = 0x808C_0000L;
    public static final long BadOutOfService = 0x808D_0000L;
    public static final long BadDataLost = 0x809D_0000L;
    public static final long BadDataUnavailable = 0x809E_0000L;
    public static final long BadInvalidArgument = 0x80AB_0000L;
    public static final long BadRequestTooLarge = 0x80B8_0000L;
    public static final long BadResponseTooLarge = 0x80B9_0000L;

    public static final long UncertainNoCommunicationLastUsableValue = 0x408F_0000L;
    public static final long UncertainLastUsableValue = 0x4090_0000L;
    public static final long UncertainSubstituteValue = 0x4091_0000L;
    public static final long UncertainInitialValue = 0x4092_0000L;
    public static final long UncertainSensorNotAccurate = 0x4093_0000L;
    public static final long UncertainEngineeringUnitsExceeded = 0x4094_0000L;
    public static final long UncertainSubNormal = 0x4095_0000L;

    public static final long GoodClamped = 0x0030_0000L;
    public static final long GoodLocalOverride = 0x0096_0000L;
    public static final long GoodNoData = 0x00A5_0000L;
    public static final long GoodMoreData = 0x00A6_0000L;

    private static final Map<Long, String> SYMBOLS;
    private static final Map<String, Long> CODES;

    static {
        Map<Long, String> symbols = new HashMap<>();
        Map<String, Long> codes = new HashMap<>();
        for (java.lang.reflect.Field field : StatusCodes.class.getDeclaredFields()) {
            if (field.getType() == long.class
                    && java.lang.reflect.Modifier.isPublic(field.getModifiers())) {
                try {
                    long code = field.getLong(null);
                    symbols.put(code, field.getName());
                    codes.put(field.getName(), code);
                }
                catch (IllegalAccessException e) {
                    throw new ExceptionInInitializerError(e);
                }
            }
        }
        SYMBOLS = Collections.unmodifiableMap(symbols);
        CODES = Collections.unmodifiableMap(codes);
    }

    private StatusCodes() {}

    /**
     * Symbolic name for the given code bits.
     */
    public static Optional<String> symbolOf(long codeBits)
    {
        return Optional.ofNullable(SYMBOLS.get(codeBits));
    }

    /**
     * Code bits for the given symbolic name.
     */
    public static Optional<Long> codeOf(String symbol)
    {
        return Optional.ofNullable(CODES.get(symbol));
    }
}
