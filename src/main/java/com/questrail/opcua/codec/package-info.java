/**
 * OPC UA Codec: Built-in Type System
 * =============================================================================
 *
 * <p>This package defines the <strong>format-neutral layer</strong> of the
 * codec: the {@link com.questrail.opcua.codec.UaEncoder} and
 * {@link com.questrail.opcua.codec.UaDecoder} contracts that structured types
 * program against, the type registry, and the per-message context.</p>
 *
 * <h2>Normative Authority</h2>
 * <p><strong>OPC UA Part 6 (Mappings)</strong> defines the three wire
 * formats. Each lives in its own subpackage:</p>
 *
 * <ul>
 *   <li>{@code binary}: §5.2, little-endian, Netty {@code ByteBuf} based</li>
 *   <li>{@code xml}: §5.3, JDK DOM based</li>
 *   <li>{@code json}: §5.4, Jackson tree based, four variants</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   Encodeable (structured value)
 *        → UaEncoder            (format rules applied here)
 *            → byte[]           (binary / XML / JSON message)
 *                → UaDecoder
 *                    → Encodeable, or opaque ExtensionObject body
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Encoders and decoders are single-use and not thread safe.</li>
 *   <li>{@link com.questrail.opcua.codec.EncodeableFactory} is immutable and
 *       shared.</li>
 *   <li>Every failure caused by input data is a
 *       {@link com.questrail.opcua.codec.CodecException}; an
 *       {@link com.questrail.opcua.codec.InvariantViolationException} always
 *       means a caller bug.</li>
 * </ul>
 */
package com.questrail.opcua.codec;
