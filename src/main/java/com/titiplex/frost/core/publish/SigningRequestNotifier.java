package com.titiplex.frost.core.publish;

import com.titiplex.frost.core.model.SigningRequestNotice;

public interface SigningRequestNotifier {
    void send(SigningRequestNotice notice);
}
