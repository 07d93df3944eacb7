package ru.derendyaev.VoterSurvey.sms.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InviteCommandTest {

    @Test
    void testSingleWithName() {
        InviteCommand command = InviteCommand.parse(new String[]{"6175550100", "Jane"});

        assertEquals(InviteCommand.Mode.SINGLE, command.getMode());
        assertEquals("6175550100", command.getPhone());
        assertEquals("Jane", command.getName());
    }

    @Test
    void testSingleWithoutName() {
        InviteCommand command = InviteCommand.parse(new String[]{"6175550100"});

        assertNull(command.getName());
    }

    @Test
    void testBulk() {
        InviteCommand command = InviteCommand.parse(new String[]{"--bulk", "recipients.json"});

        assertEquals(InviteCommand.Mode.BULK, command.getMode());
        assertEquals(Path.of("recipients.json"), command.getRecipientsFile());
    }

    @Test
    void testBulkWithoutFile_rejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> InviteCommand.parse(new String[]{"--bulk"}));
        assertEquals("Please provide recipients file", e.getMessage());
    }

    @Test
    void testNoArguments_rejected() {
        assertThrows(IllegalArgumentException.class, () -> InviteCommand.parse(new String[0]));
    }
}
