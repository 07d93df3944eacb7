package ru.derendyaev.VoterSurvey.sms.cli;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

/**
 * Parsed command line: either one recipient or a bulk recipients file.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class InviteCommand {

    public static final String BULK_FLAG = "--bulk";

    public static final String USAGE = """
            Usage:
              Single SMS: <phone_number> [name]
              Bulk SMS:   --bulk <recipients_file.json>

            Recipients file format:
              [{"phone": "1234567890", "name": "John Doe"}, ...]""";

    public enum Mode { SINGLE, BULK }

    private final Mode mode;
    private final String phone;
    private final String name;
    private final Path recipientsFile;

    public static InviteCommand parse(String[] args) {
        if (args == null || args.length < 1) {
            throw new IllegalArgumentException("Missing arguments");
        }

        if (BULK_FLAG.equals(args[0])) {
            if (args.length < 2) {
                throw new IllegalArgumentException("Please provide recipients file");
            }
            return new InviteCommand(Mode.BULK, null, null, Path.of(args[1]));
        }

        String name = args.length > 1 ? args[1] : null;
        return new InviteCommand(Mode.SINGLE, args[0], name, null);
    }
}
