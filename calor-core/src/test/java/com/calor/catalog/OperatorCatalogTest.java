package com.calor.catalog;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;
import org.apache.log4j.WriterAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorCatalogTest {

    @Test
    @DisplayName("One edit away from a single operator suggests it")
    void testSingleEditSuggestion() {
        assertEquals("contains", OperatorCatalog.findSimilarOperator("contans"));
        assertEquals("upper", OperatorCatalog.findSimilarOperator("uppr"));
    }

    @Test
    @DisplayName("Matching ignores case")
    void testCaseInsensitive() {
        assertTrue(OperatorCatalog.isKnownOperator("CONTAINS"));
        assertEquals("contains", OperatorCatalog.findSimilarOperator("CONTANS"));
    }

    @Test
    @DisplayName("Nothing within the threshold yields no suggestion")
    void testNoSuggestion() {
        assertNull(OperatorCatalog.findSimilarOperator("zzzzzzzz"));
        assertNull(OperatorCatalog.findSimilarOperator(""));
        assertNull(OperatorCatalog.findSimilarOperator(null));
    }

    @Test
    @DisplayName("Foreign constructs get a hint, including member calls")
    void testForeignHints() {
        assertNotNull(OperatorCatalog.getForeignHint("++"));
        assertTrue(OperatorCatalog.getForeignHint("x.ToUpper()").contains("(upper s)"));
        assertNull(OperatorCatalog.getForeignHint("zebra"));
    }

    @Test
    @DisplayName("Argument examples exist for the string family")
    void testExamples() {
        assertTrue(OperatorCatalog.getStringOpExample("substr").startsWith("(substr"));
    }

    @Test
    @DisplayName("Conditional, null-coalescing and unary aliases are catalog operators")
    void testConditionalAndUnaryAliases() {
        assertTrue(OperatorCatalog.isKnownOperator("?"));
        assertTrue(OperatorCatalog.isKnownOperator("??"));
        assertTrue(OperatorCatalog.isKnownOperator("NEG"));
        assertTrue(OperatorCatalog.isKnownOperator("bitwisenot"));
        assertTrue(OperatorCatalog.isKnownOperator("post-dec"));
        assertEquals("contains", OperatorCatalog.findSimilarOperator("contans"));
    }

    @Test
    @DisplayName("Lookups are traced on the calor logger")
    void testLookupTrace() {
        Logger logger = Logger.getLogger("com.calor");
        Level saved = logger.getLevel();
        StringWriter out = new StringWriter();
        WriterAppender appender = new WriterAppender(new PatternLayout("%p %m%n"), out);
        logger.addAppender(appender);
        logger.setLevel(Level.TRACE);
        try {
            OperatorCatalog.findSimilarOperator("uppr");
        } finally {
            logger.removeAppender(appender);
            logger.setLevel(saved);
        }
        assertTrue(out.toString().contains("TRACE Nearest operator to 'uppr': upper"), out.toString());
    }
}
