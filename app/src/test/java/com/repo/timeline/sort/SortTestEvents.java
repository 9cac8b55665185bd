package com.repo.timeline.sort;

import com.repo.timeline.core.ChangeAction;
import com.repo.timeline.core.ChangeEvent;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Event fixtures shared by the sort tests.
 */
final class SortTestEvents {

    private SortTestEvents() {
    }

    static List<ChangeEvent> random(long seed, int count) {
        Random random = new Random(seed);
        ChangeAction[] actions = ChangeAction.values();
        List<ChangeEvent> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(new ChangeEvent(
                    1_700_000_000L + random.nextInt(500),
                    "author" + random.nextInt(7),
                    "repo" + random.nextInt(4),
                    "dir" + random.nextInt(10) + "/file" + random.nextInt(50) + ".txt",
                    actions[random.nextInt(actions.length)]));
        }
        return events;
    }

    static List<ChangeEvent> sorted(List<ChangeEvent> events) {
        List<ChangeEvent> copy = new ArrayList<>(events);
        copy.sort(ChangeEvent.ORDER);
        return copy;
    }

    static List<ChangeEvent> drain(EventStream stream) throws IOException {
        List<ChangeEvent> events = new ArrayList<>();
        try (stream) {
            while (stream.hasNext()) {
                events.add(stream.next());
            }
        }
        return events;
    }

    static PrintStream quietConsole() {
        return new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
    }
}
