package com.ziplens.service.acs;

public interface AcsTransport {
    /**
     * @throws AcsRequestException on any failed call, classified for retry
     */
    AcsTable fetch(AcsQuery query);

    /**
     * Issues a minimal request and returns the HTTP status without interpreting it.
     */
    int probe(AcsQuery query);
}
