package com.pairchat.server.ws;

import com.pairchat.server.exception.RoomCodesExhaustedException;
import com.pairchat.server.exception.RoomFullException;
import com.pairchat.server.exception.RoomNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.WebSocketSession;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoomTableTest {

    private MockSessions sessions;
    private WebSocketSession a;
    private WebSocketSession b;
    private WebSocketSession c;

    @BeforeEach
    void setUp() {
        sessions = new MockSessions();
        a = sessions.open("a");
        b = sessions.open("b");
        c = sessions.open("c");
    }

    @Test
    void createRoomPlacesCreatorInNewRoom() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);

        String code = table.createRoom(a);

        assertEquals("4821", code);
        assertEquals(Set.of(a), table.membersOf(code));
        assertEquals(1, table.openRooms());
    }

    @Test
    void createRoomSkipsCodesHeldByOpenRooms() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821", "4821", "4821", "1234"), 2, 10);

        assertEquals("4821", table.createRoom(a));
        assertEquals("1234", table.createRoom(b));
    }

    @Test
    void createRoomGivesUpAfterBoundedAttempts() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 5);
        table.createRoom(a);

        RoomCodesExhaustedException e = assertThrows(RoomCodesExhaustedException.class, () -> table.createRoom(b));
        assertEquals(5, e.getAttempts());
        assertEquals(Set.of(a), table.membersOf("4821"));
    }

    @Test
    void joinUnknownRoomFailsWithoutMutation() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);
        table.createRoom(a);

        assertThrows(RoomNotFoundException.class, () -> table.join("9999", b));
        assertFalse(table.isOpen("9999"));
        assertEquals(Set.of(a), table.membersOf("4821"));
    }

    @Test
    void joinFullRoomFailsWithoutAddingRequester() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);
        table.createRoom(a);
        assertEquals(Set.of(a, b), table.join("4821", b));

        RoomFullException e = assertThrows(RoomFullException.class, () -> table.join("4821", c));
        assertEquals("4821", e.getRoom());
        assertEquals(Set.of(a, b), table.membersOf("4821"));
    }

    @Test
    void lastLeaveDeletesRoomAndFreesCode() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);
        table.createRoom(a);
        table.join("4821", b);

        assertEquals(Set.of(a), table.leave("4821", b));
        assertTrue(table.isOpen("4821"));

        assertTrue(table.leave("4821", a).isEmpty());
        assertFalse(table.isOpen("4821"));
        assertTrue(table.membersOf("4821").isEmpty());
        assertThrows(RoomNotFoundException.class, () -> table.join("4821", c));

        // freed code can be handed out again
        assertEquals("4821", table.createRoom(c));
    }

    @Test
    void leaveOfUnknownRoomIsNoop() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);

        assertTrue(table.leave("4821", a).isEmpty());
        assertEquals(0, table.openRooms());
    }

    @Test
    void membersOfReturnsSnapshot() {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);
        table.createRoom(a);
        Set<WebSocketSession> before = table.membersOf("4821");

        table.join("4821", b);

        assertEquals(Set.of(a), before);
        assertEquals(Set.of(a, b), table.membersOf("4821"));
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RoomTable(new FixedRoomCodes("1"), 0, 10));
    }

    @Test
    void concurrentJoinsNeverExceedCapacity() throws Exception {
        RoomTable table = new RoomTable(new FixedRoomCodes("4821"), 2, 10);
        table.createRoom(a);

        int joiners = 16;
        ExecutorService pool = Executors.newFixedThreadPool(joiners);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < joiners; i++) {
            WebSocketSession s = sessions.open("j" + i);
            results.add(pool.submit(() -> {
                start.await();
                try {
                    table.join("4821", s);
                    return true;
                } catch (RoomFullException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int admitted = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) admitted++;
        }
        pool.shutdown();

        assertEquals(1, admitted);
        assertEquals(2, table.membersOf("4821").size());
    }

    @Test
    void randomCodesAreDistinctWhileRoomsAreOpen() {
        RoomTable table = new RoomTable(new RandomRoomCodeGenerator(), 2, 1000);
        Set<String> codes = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String code = table.createRoom(sessions.open("s" + i));
            assertTrue(codes.add(code), "duplicate code " + code);
            int n = Integer.parseInt(code);
            assertTrue(n >= 1000 && n <= 9999, code);
        }
        assertEquals(500, table.openRooms());
    }
}
