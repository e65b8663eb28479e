package utilities;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class IndexLoggerTest {

    @Test
    void debugIsOffWithoutALogFile() {
        assertNull(System.getProperty(IndexLogger.LOG_FILE_PROPERTY));

        IndexLogger.info("logger initialised");
        assertFalse(IndexLogger.isDebugEnabled());
        assertEquals(Level.INFO, Logger.getLogger(IndexLogger.class.getName()).getLevel());
    }
}
