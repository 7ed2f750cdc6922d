package decision.utility;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EnumsTests {

    @Test
    @DisplayName("Node role tags should be matched ignoring case")
    void testFromTag() throws OptException {
        assertEquals(Enums.NodeRole.CHANCE, Enums.NodeRole.fromTag("chance"));
        assertEquals(Enums.NodeRole.DECISION, Enums.NodeRole.fromTag("Decision"));
        assertEquals(Enums.NodeRole.VALUE, Enums.NodeRole.fromTag(" VALUE "));
    }

    @Test
    @DisplayName("Unknown node role tag should fail with UNKNOWN_NODE_CLASS")
    void testUnknownTag() {
        OptException ex = assertThrows(OptException.class, () -> Enums.NodeRole.fromTag("utility"));
        assertEquals(Enums.ErrorKind.UNKNOWN_NODE_CLASS, ex.getKind());
        assertThrows(OptException.class, () -> Enums.NodeRole.fromTag(null));
    }
}
