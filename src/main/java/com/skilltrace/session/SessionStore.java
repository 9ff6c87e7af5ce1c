package com.skilltrace.session;

import com.skilltrace.session.SessionModels.SessionRecord;

import java.util.List;

public interface SessionStore {

    void append(SessionRecord record);

    /** All sessions of one learner in append order; empty when the learner is unknown. */
    List<SessionRecord> readAll(String learnerId);
}
