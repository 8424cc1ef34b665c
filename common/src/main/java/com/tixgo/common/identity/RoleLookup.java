package com.tixgo.common.identity;

public interface RoleLookup {

    /**
     * Unknown emails resolve to a plain user in good standing.
     */
    CallerRole lookup(String email);
}
