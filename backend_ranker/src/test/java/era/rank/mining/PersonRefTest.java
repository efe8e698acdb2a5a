package era.rank.mining;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class PersonRefTest {
    @Test
    public void parsesGlobalReference() {
        PersonRef ref = PersonRef.parse("global:4f1c");
        assertTrue(ref.isGlobal());
        assertEquals("4f1c", ref.getGlobalId());
        assertEquals("global:4f1c", ref.toString());
    }

    @Test
    public void albumIdMayContainColons() {
        PersonRef ref = PersonRef.parse("album:2024:summer:3");
        assertFalse(ref.isGlobal());
        assertEquals("2024:summer", ref.getAlbumId());
        assertEquals(3, ref.getClusterIndex());
        assertEquals(ref, PersonRef.parse(ref.toString()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsUnknownScheme() {
        PersonRef.parse("person:1");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMissingIndex() {
        PersonRef.parse("album:trip:x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeIndex() {
        PersonRef.parse("album:trip:-1");
    }
}
