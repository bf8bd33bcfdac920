package com.github.dimitryivaniuta.governance.token;

import com.github.dimitryivaniuta.governance.core.Identity;

/**
 * Compact signed token together with the identity it carries.
 */
public record IssuedToken(String token, Identity identity) {

    @Override
    public String toString() {
        // keep the bearer credential out of logs
        return "IssuedToken[subject=" + identity.subjectId() + ", tokenId=" + identity.tokenId() + "]";
    }
}
