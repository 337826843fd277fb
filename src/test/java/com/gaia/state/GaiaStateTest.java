package com.gaia.state;

import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GaiaState.
 */
class GaiaStateTest {

    private GaiaState state;

    @BeforeEach
    void setUp() {
        state = new GaiaState();
    }

    @Test
    @DisplayName("Fresh state has nothing visited")
    void freshStateIsEmpty() {
        assertTrue(state.isUrlNew("/home"));
        assertTrue(state.isDomNew("abc"));
        assertFalse(state.wasTestFailed("t1"));
        assertFalse(state.isTestCompleted("t1"));
        assertNull(state.getCurrentDomSignature());
        assertEquals(0, state.getExecutionRound());
    }

    @Test
    @DisplayName("Visited URL is no longer new")
    void markUrlVisited() {
        state.markUrlVisited("/home");

        assertFalse(state.isUrlNew("/home"));
        assertTrue(state.isUrlNew("/about"));
    }

    @Test
    @DisplayName("Seen DOM becomes the current signature")
    void markDomSeen() {
        state.markDomSeen("dom-a");
        state.markDomSeen("dom-b");

        assertFalse(state.isDomNew("dom-a"));
        assertFalse(state.isDomNew("dom-b"));
        assertEquals("dom-b", state.getCurrentDomSignature());
        assertEquals(2, state.getVisitedDomSignatures().size());
    }

    @Test
    @DisplayName("Null and empty input is ignored")
    void ignoresEmptyInput() {
        state.markUrlVisited(null);
        state.markUrlVisited("");
        state.markDomSeen(null);
        state.markDomSeen("");
        state.markTestFailed("");
        state.markTestCompleted(null);

        StateSnapshot snapshot = state.snapshot();
        assertEquals(0, snapshot.visitedUrls());
        assertEquals(0, snapshot.visitedDomSignatures());
        assertEquals(0, snapshot.failedTests());
        assertEquals(0, snapshot.completedTests());
        assertNull(state.getCurrentDomSignature());
    }

    @Test
    @DisplayName("Completing a failed test clears the failure")
    void completionClearsFailure() {
        state.markTestFailed("t1");
        assertTrue(state.wasTestFailed("t1"));

        state.markTestCompleted("t1");

        assertTrue(state.isTestCompleted("t1"));
        assertFalse(state.wasTestFailed("t1"));
    }

    @Test
    @DisplayName("Snapshot reports set sizes and round")
    void snapshotCounts() {
        state.markUrlVisited("/a");
        state.markUrlVisited("/b");
        state.markUrlVisited("/a");
        state.markDomSeen("dom");
        state.markTestFailed("t1");
        state.markTestCompleted("t2");
        state.incrementRound();
        state.incrementRound();

        StateSnapshot snapshot = state.snapshot();

        assertEquals(2, snapshot.visitedUrls());
        assertEquals(1, snapshot.visitedDomSignatures());
        assertEquals(1, snapshot.completedTests());
        assertEquals(1, snapshot.failedTests());
        assertEquals(2, snapshot.executionRounds());
    }

    @Test
    @DisplayName("Reset restores initial values")
    void resetClearsEverything() {
        state.markUrlVisited("/a");
        state.markDomSeen("dom");
        state.markTestFailed("t1");
        state.markTestCompleted("t2");
        state.incrementRound();

        state.reset();

        assertEquals(new StateSnapshot(0, 0, 0, 0, 0), state.snapshot());
        assertNull(state.getCurrentDomSignature());
    }

    @Test
    @DisplayName("Exposed sets are read-only")
    void exposedSetsAreUnmodifiable() {
        state.markUrlVisited("/a");

        assertThrows(UnsupportedOperationException.class, () -> state.getVisitedUrls().add("/b"));
        assertThrows(UnsupportedOperationException.class, () -> state.getCompletedTestIds().clear());
    }
}
