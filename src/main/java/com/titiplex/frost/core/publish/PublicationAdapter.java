package com.titiplex.frost.core.publish;

import com.titiplex.frost.core.model.FinalSignature;

/**
 * Hands a completed signature to whatever transmits the signed message.
 */
public interface PublicationAdapter {
    /**
     * @return opaque publication identifier
     * @throws PublicationException if the message could not be published
     */
    String publish(String sessionId, FinalSignature signature, String messageTemplate, String groupPublicKey);
}
