package com.recordguard.application;

import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SessionState;

import java.util.List;

/**
 * Open-ended answer path used when an authorized request needs no record
 * lookup. Its output still goes through output sanitization.
 */
public interface OpenAnswerResponder {

    String answer(Principal principal, List<SessionState.Exchange> history, String request);
}
