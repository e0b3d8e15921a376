package com.titiplex.frost.core.publish;

import com.titiplex.frost.core.model.CompletionNotice;

public interface CompletionNotifier {
    void send(CompletionNotice notice);
}
