package org.example.learnpath.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class CodeSnippetSanitizerTest {

    private final CodeSnippetSanitizer sanitizer = new CodeSnippetSanitizer();

    @Test
    void sanitize_fencedBlockWithLanguage_returnsInnerCode() {
        String raw = "```python\ndef add(a, b):\n    return a + b\n```";

        assertEquals("def add(a, b):\n    return a + b", sanitizer.sanitize(raw));
    }

    @Test
    void sanitize_fencedBlockWithoutLanguage_returnsInnerCode() {
        assertEquals("SELECT 1;", sanitizer.sanitize("  ```\nSELECT 1;\n```  "));
    }

    @Test
    void sanitize_plainCode_isTrimmedVerbatim() {
        assertEquals("int x = 1;", sanitizer.sanitize("\n  int x = 1;  \n"));
    }

    @Test
    void sanitize_nullOrBlank_returnsEmpty() {
        assertEquals("", sanitizer.sanitize(null));
        assertEquals("", sanitizer.sanitize("   "));
    }

    @Test
    void sanitize_nestedStrayFence_isRemoved() {
        String raw = "```java\n```java\nint y = 2;\n```";

        assertEquals("int y = 2;", sanitizer.sanitize(raw));
    }

    @Test
    void sanitize_fencedBlockWithAnyLanguageTag_returnsInnerCode() {
        assertEquals("const x = 1;", sanitizer.sanitize("```typescript\nconst x = 1;\n```"));
        assertEquals("fn main() {}", sanitizer.sanitize("```objective-c++\nfn main() {}\n```"));
    }

    @Test
    void sanitize_closingFenceWithoutNewline_returnsInnerCode() {
        assertEquals("val y = 2", sanitizer.sanitize("```kotlin\nval y = 2```"));
    }
}
