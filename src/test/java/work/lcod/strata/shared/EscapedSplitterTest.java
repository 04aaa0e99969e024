package work.lcod.strata.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class EscapedSplitterTest {
    @Test
    void splitsOnUnescapedSeparators() {
        assertEquals(List.of("max:0", "comment:Easy as 1,2,3"), EscapedSplitter.split("max:0,comment:Easy as 1\\,2\\,3", ","));
        assertEquals(List.of("a", ""), EscapedSplitter.split("a,", ","));
        assertEquals(List.of(""), EscapedSplitter.split("", ","));
    }

    @Test
    void limitKeepsRemainderTogether() {
        assertEquals(List.of("key", "a:b"), EscapedSplitter.split("key:a:b", ":", EscapedSplitter.BACKSLASH, 2));
        assertEquals(List.of("plain"), EscapedSplitter.split("plain", ":", EscapedSplitter.BACKSLASH, 2));
        assertEquals(List.of(), EscapedSplitter.split("a,b", ",", EscapedSplitter.BACKSLASH, 0));
    }

    @Test
    void findsFirstUnescapedIndex() {
        assertEquals(4, EscapedSplitter.indexOf("a\\,b,c", ",", EscapedSplitter.BACKSLASH));
        assertEquals(-1, EscapedSplitter.indexOf("a\\,b", ",", EscapedSplitter.BACKSLASH));
        assertEquals(1, EscapedSplitter.indexOf("a,b", ",", ""));
    }
}
