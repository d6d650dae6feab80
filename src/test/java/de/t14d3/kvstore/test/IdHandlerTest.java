package de.t14d3.kvstore.test;

import de.t14d3.kvstore.exceptions.InvalidIdentifierException;
import de.t14d3.kvstore.id.CompositeIdHandler;
import de.t14d3.kvstore.id.SingleIdHandler;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.test.entities.Reservation;
import de.t14d3.kvstore.test.entities.User;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IdHandlerTest {
    private final SingleIdHandler single = new SingleIdHandler();
    private final CompositeIdHandler composite = new CompositeIdHandler();
    private final EntityMetadata users = EntityMetadata.of(User.class);
    private final EntityMetadata reservations = EntityMetadata.of(Reservation.class);

    @Test
    void testSingleNormalizesScalarAndMap() {
        assertEquals(5L, single.normalizeId(users, 5L));
        assertEquals(5L, single.normalizeId(users, Map.of("id", 5L, "ignored", "x")));
    }

    @Test
    void testSingleRejectsInvalidKeys() {
        assertThrows(InvalidIdentifierException.class, () -> single.normalizeId(users, Map.of("other", 1L)));
        assertThrows(InvalidIdentifierException.class, () -> single.normalizeId(users, null));
        assertThrows(InvalidIdentifierException.class, () -> single.normalizeId(reservations, "H1"));
    }

    @Test
    void testSingleReadsIdentifierOffInstance() {
        assertEquals(3L, single.getIdentifier(users, new User(3L, "a", null)));
        assertNull(single.getIdentifier(users, new User(null, "a", null)));
        assertEquals("3", single.hash(3L));
    }

    @Test
    void testCompositeNormalizesInDeclaredOrder() {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("room", 7);
        key.put("guest", "dropped");
        key.put("hotel", "H1");

        Object id = composite.normalizeId(reservations, key);

        assertEquals(Map.of("hotel", "H1", "room", 7), id);
        assertEquals(List.of("hotel", "room"), List.copyOf(((Map<?, ?>) id).keySet()));
    }

    @Test
    void testCompositeWrapsScalarForSingleFieldIdentifier() {
        assertEquals(Map.of("id", 5L), composite.normalizeId(users, 5L));
    }

    @Test
    void testCompositeRejectsIncompleteKeys() {
        InvalidIdentifierException e = assertThrows(InvalidIdentifierException.class,
                () -> composite.normalizeId(reservations, Map.of("hotel", "H1")));
        assertTrue(e.getMessage().contains("room"));
        assertThrows(InvalidIdentifierException.class, () -> composite.normalizeId(reservations, "H1"));
    }

    @Test
    void testCompositeIdentifierIsNullUntilComplete() {
        assertNull(composite.getIdentifier(reservations, new Reservation("H1", null, "Bob")));
        assertEquals(Map.of("hotel", "H1", "room", 2), composite.getIdentifier(reservations, new Reservation("H1", 2, "Bob")));
    }

    @Test
    void testCompositeHashIsStableAndOrderDependent() {
        Object first = composite.normalizeId(reservations, Map.of("hotel", "H1", "room", 7));
        Object second = composite.getIdentifier(reservations, new Reservation("H1", 7, "Bob"));
        assertEquals(composite.hash(first), composite.hash(second));

        Map<String, Object> swapped = new LinkedHashMap<>();
        swapped.put("room", 7);
        swapped.put("hotel", "H1");
        assertNotEquals(composite.hash(first), composite.hash(swapped));
    }

    @Test
    void testCompositeHashDistinguishesFieldValues() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("hotel", "H1");
        a.put("room", 17);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("hotel", "H11");
        b.put("room", 7);

        assertNotEquals(composite.hash(a), composite.hash(b));
    }

    @Test
    void testCompositeHashIsUnambiguousForValuesContainingDelimiters() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", "x__b=y");
        first.put("b", "z");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", "x");
        second.put("b", "y__b=z");

        assertNotEquals(composite.hash(first), composite.hash(second));

        Map<String, Object> third = new LinkedHashMap<>();
        third.put("a", "x;1:b=1:y");
        Map<String, Object> fourth = new LinkedHashMap<>();
        fourth.put("a", "x");
        fourth.put("b", "y");
        assertNotEquals(composite.hash(third), composite.hash(fourth));
    }
}
