package com.fleetgate.gateway.handoff;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code @handle} mentions of known agents in a reply and tags each with
 * whether it asks the mentioned agent to act.
 */
public class HandoffIntentExtractor {

    private static final List<String> REQUEST_PHRASES = List.of(
            "@%s can you",
            "@%s please",
            "@%s could you",
            "@%s your turn",
            "@%s take over",
            "handoff to @%s",
            "hand off to @%s",
            "assigning @%s");

    /**
     * @param text          the reply
     * @param knownHandles  handles eligible as targets, without the leading {@code @}
     * @return one intent per mentioned handle, in order of first appearance
     */
    public List<HandoffIntent> extract(String text, Collection<String> knownHandles) {
        if (text == null || text.isBlank() || knownHandles.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<Mention> mentions = new ArrayList<>();
        for (String handle : knownHandles) {
            if (handle == null || handle.isBlank() || !seen.add(handle.toLowerCase(Locale.ROOT))) {
                continue;
            }
            int at = firstMention(text, handle);
            if (at >= 0) {
                mentions.add(new Mention(handle, at));
            }
        }
        mentions.sort((a, b) -> Integer.compare(a.position, b.position));

        List<HandoffIntent> intents = new ArrayList<>();
        for (Mention mention : mentions) {
            intents.add(classify(text, mention.handle));
        }
        return intents;
    }

    HandoffIntent classify(String text, String handle) {
        String lowered = text.toLowerCase(Locale.ROOT);
        String handleLower = handle.toLowerCase(Locale.ROOT);
        for (String phrase : REQUEST_PHRASES) {
            if (lowered.contains(String.format(phrase, handleLower))) {
                return new HandoffIntent(handle, true, "request phrasing");
            }
        }
        Pattern question = Pattern.compile("@" + Pattern.quote(handle) + "\\b[^\\n\\r]{0,120}\\?",
                Pattern.CASE_INSENSITIVE);
        if (question.matcher(text).find()) {
            return new HandoffIntent(handle, true, "question to mentioned agent");
        }
        return new HandoffIntent(handle, false, "referential mention");
    }

    private static int firstMention(String text, String handle) {
        Matcher matcher = Pattern.compile("@" + Pattern.quote(handle) + "\\b", Pattern.CASE_INSENSITIVE).matcher(text);
        return matcher.find() ? matcher.start() : -1;
    }

    private record Mention(String handle, int position) {
    }
}
