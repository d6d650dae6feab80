package de.t14d3.kvstore.test;

import de.t14d3.kvstore.annotations.Embeddable;
import de.t14d3.kvstore.annotations.Embedded;
import de.t14d3.kvstore.annotations.Entity;
import de.t14d3.kvstore.annotations.Id;
import de.t14d3.kvstore.exceptions.MappingException;
import de.t14d3.kvstore.mapping.EntityMetadata;
import de.t14d3.kvstore.mapping.FieldKind;
import de.t14d3.kvstore.test.entities.Address;
import de.t14d3.kvstore.test.entities.Customer;
import de.t14d3.kvstore.test.entities.Reservation;
import de.t14d3.kvstore.test.entities.User;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class EntityMetadataTest {

    @Entity
    static class Untitled {
        @Id
        private Long id;
        private transient String cache;
        private static String constant = "x";
    }

    @Entity
    static class NoId {
        private String name;
    }

    static class NotMapped {
        @Id
        private Long id;
    }

    @Entity
    static class BadEmbedded {
        @Id
        private Long id;
        @Embedded
        private String street;
    }

    @Embeddable
    static class Point {
        private int x;
        private int y;
    }

    @Test
    void testStorageNameAndIdentifier() {
        EntityMetadata metadata = EntityMetadata.of(User.class);

        assertEquals("users", metadata.getStorageName());
        assertEquals(User.class.getName(), metadata.getName());
        assertEquals(List.of("id"), metadata.getIdentifier());
        assertFalse(metadata.isCompositeKey());
        assertSame(metadata, EntityMetadata.of(User.class));
    }

    @Test
    void testDefaultStorageNameIsLowerCaseSimpleName() {
        EntityMetadata metadata = EntityMetadata.of(Untitled.class);
        assertEquals("untitled", metadata.getStorageName());
    }

    @Test
    void testStaticFieldsAreIgnoredAndTransientModifierHonoured() {
        EntityMetadata metadata = EntityMetadata.of(Untitled.class);
        assertFalse(metadata.hasField("constant"));
        assertEquals(FieldKind.TRANSIENT, metadata.getField("cache").kind());
    }

    @Test
    void testCompositeIdentifierKeepsDeclaredOrder() {
        EntityMetadata metadata = EntityMetadata.of(Reservation.class);
        assertEquals(List.of("hotel", "room"), metadata.getIdentifier());
        assertTrue(metadata.isCompositeKey());
        assertTrue(metadata.isIdentifier("room"));
        assertFalse(metadata.isIdentifier("guest"));
        assertEquals(Map.of("hotel", "H1", "room", 3),
                metadata.getIdentifierValues(new Reservation("H1", 3, "Bob")));
    }

    @Test
    void testFieldKinds() {
        EntityMetadata metadata = EntityMetadata.of(Customer.class);
        assertEquals(FieldKind.EMBEDDED, metadata.getField("address").kind());
        assertEquals(Address.class, metadata.getField("address").embeddedType());
        assertEquals(FieldKind.TRANSIENT, metadata.getField("sessionToken").kind());
        assertEquals(FieldKind.PLAIN, metadata.getField("tags").kind());
        assertTrue(metadata.getField("id").identifier());
    }

    @Test
    void testEmbeddableHasNoStorageName() {
        EntityMetadata metadata = EntityMetadata.of(Address.class);
        assertTrue(metadata.isEmbeddable());
        assertNull(metadata.getStorageName());
        assertTrue(metadata.getIdentifier().isEmpty());
    }

    @Test
    void testPrimitiveFieldIgnoresNull() {
        EntityMetadata metadata = EntityMetadata.of(Point.class);
        Point point = (Point) metadata.newInstance();

        metadata.setFieldValue(point, metadata.getField("x"), 5L);
        metadata.setFieldValue(point, metadata.getField("y"), null);

        assertEquals(5, point.x);
        assertEquals(0, point.y);
    }

    @Test
    void testEntityWithoutIdRejected() {
        MappingException e = assertThrows(MappingException.class, () -> EntityMetadata.of(NoId.class));
        assertTrue(e.getMessage().contains("@Id"));
    }

    @Test
    void testUnannotatedClassRejected() {
        assertThrows(MappingException.class, () -> EntityMetadata.of(NotMapped.class));
    }

    @Test
    void testEmbeddedTargetMustBeEmbeddable() {
        assertThrows(MappingException.class, () -> EntityMetadata.of(BadEmbedded.class));
    }
}
