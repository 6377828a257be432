package org.Aayush.app;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @Test
    void testMainOutputsExpectedLines() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer));
            Main.main(new String[0]);
        } finally {
            System.setOut(originalOut);
        }

        String output = buffer.toString();
        assertTrue(output.contains("school choice (DA): DEFERRED_ACCEPTANCE in 1 rounds"));
        assertTrue(output.contains("  ana = [north]"));
        assertTrue(output.contains("  ben = [south]"));
        assertTrue(output.contains("house swap (TTC): TOP_TRADING_CYCLES in 2 rounds"));
        assertTrue(output.contains("  tenant-1 = [house-B]"));
        assertTrue(output.contains("  tenant-2 = [house-A]"));
    }
}
