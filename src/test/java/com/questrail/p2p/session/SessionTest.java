package com.questrail.p2p.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class SessionTest
{
    @Test
    void requestAdvancesToResponseThenConsumed()
    {
        Session session = Session.request(1);

        assertEquals(SessionStage.RESPONSE, session.processLifecycle());
        assertEquals(SessionStage.CONSUMED, session.processLifecycle());
        assertEquals(SessionStage.CONSUMED, session.stage());
    }

    @Test
    void consumedSessionCannotAdvance()
    {
        Session session = Session.request(1);
        session.processLifecycle();
        session.processLifecycle();

        assertThrows(InvalidSessionStateException.class, session::processLifecycle);
        assertEquals(SessionStage.CONSUMED, session.stage());
    }

    @Test
    void inactiveSessionCannotAdvance()
    {
        Session session = Session.inactive(1);

        assertThrows(InvalidSessionStateException.class, session::processLifecycle);
        assertEquals(SessionStage.INACTIVE, session.stage());
    }

    @Test
    void consumedIsNotAcceptedFromTheWire()
    {
        assertThrows(InvalidSessionStateException.class, () -> Session.fromWire(3, SessionStage.CONSUMED));
        assertEquals(SessionStage.RESPONSE, Session.fromWire(3, SessionStage.RESPONSE).stage());
    }

    @Test
    void terminalStages()
    {
        assertFalse(SessionStage.REQUEST.isTerminal());
        assertFalse(SessionStage.RESPONSE.isTerminal());
        assertTrue(SessionStage.CONSUMED.isTerminal());
        assertTrue(SessionStage.INACTIVE.isTerminal());
    }
}
