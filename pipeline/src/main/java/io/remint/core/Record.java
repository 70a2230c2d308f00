package io.remint.core;

/**
 * A payload tagged with its position in the input so that failures and ordering can be traced back.
 *
 * @param seq    monotonically increasing across the whole source
 * @param subSeq secondary position, e.g. the index of the file the payload came from
 * @param payload the carried value
 */
public record Record<T>(long seq, int subSeq, T payload) {}
