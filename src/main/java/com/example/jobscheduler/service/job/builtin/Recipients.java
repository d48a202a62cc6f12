package com.example.jobscheduler.service.job.builtin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the {@code recips} option, given either as a list or as
 * one string separated by commas or whitespace.
 */
final class Recipients {

    private Recipients() {
    }

    static List<String> parse(List<String> recips) {
        var result = new ArrayList<String>();
        if (recips == null) {
            return result;
        }
        for (var entry : recips) {
            if (entry == null) {
                continue;
            }
            Arrays.stream(entry.split("[,\\s]+"))
                    .map(String::trim)
                    .filter(r -> !r.isEmpty())
                    .forEach(result::add);
        }
        return result;
    }
}
