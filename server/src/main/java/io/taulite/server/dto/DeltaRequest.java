package io.taulite.server.dto;

/**
 * One delta in a request body.
 * Example:
 *   { "value": "+1.5", "validFromNs": 1000, "validUntilNs": 2000 }
 * A bare JSON number is accepted for {@code value} as well.
 */
public class DeltaRequest {
    public String value;
    public long validFromNs;
    public long validUntilNs;
}
