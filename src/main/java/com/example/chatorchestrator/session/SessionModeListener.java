package com.example.chatorchestrator.session;

import com.example.chatorchestrator.model.DeliveryMode;
import com.example.chatorchestrator.model.SessionMode;

/**
 * Receives the state broadcast issued after a session's mode was recomputed and changed.
 */
public interface SessionModeListener {

    void onSessionModeChanged(String sessionId, SessionMode mode, DeliveryMode deliveryMode);
}
