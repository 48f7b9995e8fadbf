package ai.apigraph.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Names.
 */
class NamesTest {

    @Test
    void whenFullyQualified_givenEmptyQualifiedName_shouldReturnModule() {
        assertEquals("pkg.shapes", Names.fullyQualified("pkg.shapes", ""));
        assertEquals("pkg.shapes::Circle.area", Names.fullyQualified("pkg.shapes", "Circle.area"));
    }

    @Test
    void whenMember_givenModuleOrClassParent_shouldUseMatchingSeparator() {
        assertEquals("pkg::x", Names.member("pkg", "x"));
        assertEquals("pkg::Cls.x", Names.member("pkg::Cls", "x"));
    }

    @Test
    void whenParseFqn_givenNestedMember_shouldSplitModuleAndPath() {
        assertEquals(List.of("pkg.shapes", "Circle", "area"), Names.parseFqn("pkg.shapes::Circle.area"));
        assertEquals(List.of("pkg.shapes"), Names.parseFqn("pkg.shapes"));
        assertEquals("pkg.shapes", Names.moduleOf("pkg.shapes::Circle"));
    }

    @Test
    void whenParentOf_givenTopLevelName_shouldReturnEmpty() {
        assertEquals("", Names.parentOf("Circle"));
        assertEquals("Circle", Names.parentOf("Circle.area"));
        assertEquals("area", Names.simpleNameOf("Circle.area"));
    }

    @Test
    void whenClassifyingNames_givenUnderscores_shouldSeparatePrivateFromSpecial() {
        assertTrue(Names.isPrivate("_hidden"));
        assertFalse(Names.isPrivate("__init__"));
        assertTrue(Names.isSpecial("__init__"));
        assertFalse(Names.isSpecial("public"));
    }

    @Test
    void whenAbbreviate_givenLongText_shouldTruncateWithEllipsis() {
        assertEquals("abcd...", Names.abbreviate("abcdefghij", 7));
        assertEquals("abc", Names.abbreviate("abc", 7));
        assertEquals("", Names.abbreviate(null, 7));
    }
}
