package de.t14d3.kvstore.test;

import de.t14d3.kvstore.core.EntityManager;
import de.t14d3.kvstore.exceptions.NotManagedException;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.storage.InMemoryStorage;
import de.t14d3.kvstore.test.entities.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EntityManagerTest {
    private InMemoryStorage storage;
    private EntityManager em;

    @BeforeEach
    void setup() {
        storage = new InMemoryStorage();
        em = EntityManager.create(storage);
    }

    @Test
    void testPersistAndFind() {
        User user = new User(1L, "john_doe", "john@example.com");
        em.persist(user);
        assertFalse(em.contains(user));
        em.flush();

        assertTrue(em.contains(user));
        assertSame(user, em.find(User.class, 1L));
        assertEquals(1, storage.count("users"));

        em.clear();
        User found = em.find(User.class, 1L);
        assertNotSame(user, found);
        assertEquals("john_doe", found.getUsername());
        assertEquals("john@example.com", found.getEmail());
        assertEquals(1L, found.getId());
    }

    @Test
    void testFindMissingReturnsNull() {
        assertNull(em.find(User.class, 99L));
        assertNull(em.find(User.class, null));
    }

    @Test
    void testUpdate() {
        em.persist(new User(1L, "john_doe", "john@example.com"));
        em.flush();

        User user = em.find(User.class, 1L);
        user.setEmail("john.doe@example.com");
        em.flush();
        em.clear();

        assertEquals("john.doe@example.com", em.find(User.class, 1L).getEmail());
    }

    @Test
    void testRemove() {
        User user = new User(1L, "john_doe", "john@example.com");
        em.persist(user);
        em.flush();

        em.remove(user);
        em.flush();

        assertFalse(em.contains(user));
        assertEquals(0, storage.count("users"));
        assertNull(em.find(User.class, 1L));
    }

    @Test
    void testRemoveOfNewEntityRejected() {
        assertThrows(NotManagedException.class, () -> em.remove(new User(1L, "a", null)));
    }

    @Test
    void testDetachStopsTracking() {
        em.persist(new User(1L, "john_doe", "john@example.com"));
        em.flush();
        User user = em.find(User.class, 1L);

        em.detach(user);
        user.setEmail("changed@example.com");
        em.flush();

        assertFalse(em.contains(user));
        assertEquals("john@example.com", storage.find("users", 1L).orElseThrow().get("email"));
    }

    @Test
    void testNullArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> EntityManager.create(null));
        assertThrows(IllegalArgumentException.class, () -> EntityManager.create(storage, null));
        assertThrows(IllegalArgumentException.class, () -> em.persist(null));
        assertThrows(IllegalArgumentException.class, () -> em.remove(null));
        assertThrows(IllegalArgumentException.class, () -> em.detach(null));
        assertFalse(em.contains(null));
    }

    @Test
    void testClassMetadata() {
        EntityMetadata metadata = em.getClassMetadata(User.class);
        assertEquals("users", metadata.getStorageName());
        assertSame(storage, em.getStorage());
        assertNotNull(em.getUnitOfWork());
    }
}
