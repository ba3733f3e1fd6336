package com.largomodo.rawconvert.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemTest {

    @ParameterizedTest
    @CsvSource({
            "DSC_0001.NEF,    DSC_0001,     DSC_0001.jpg",
            "holiday.shot.cr2, holiday.shot, holiday.shot.jpg",
            "noextension,     noextension,  noextension.jpg",
            ".hidden,         .hidden,      .hidden.jpg"
    })
    void testOutputNameReplacesExtension(String fileName, String baseName, String outputName) {
        WorkItem item = new WorkItem(fileName);

        assertEquals(baseName, item.baseName());
        assertEquals(outputName, item.outputName());
    }

    @Test
    void testResolveInJoinsInputDirectory() {
        WorkItem item = new WorkItem("DSC_0001.NEF");

        assertEquals(Path.of("/photos/in/DSC_0001.NEF"), item.resolveIn(Path.of("/photos/in")));
    }

    @Test
    void testRejectsNullAndBlankNames() {
        assertThrows(NullPointerException.class, () -> new WorkItem(null));
        assertThrows(IllegalArgumentException.class, () -> new WorkItem("  "));
    }
}
