package org.kpa.tap.models.dto;

import org.kpa.tap.models.enums.StreamKind;

import java.util.regex.Pattern;

public record StreamDescriptor(
        String formId,
        String name,
        StreamKind kind
) {
    public static final String LIST_SUFFIX = "_responses_list";
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]+");

    public static StreamDescriptor listOf(Form form) {
        return new StreamDescriptor(form.id(), streamName(form.name()) + LIST_SUFFIX, StreamKind.RESPONSE_LIST);
    }

    public static StreamDescriptor detailOf(Form form) {
        return new StreamDescriptor(form.id(), streamName(form.name()), StreamKind.RESPONSE_DETAIL);
    }

    // spaces become underscores, other non-word characters are dropped
    public static String streamName(String formName) {
        String name = formName == null ? "" : formName.replace(" ", "_");
        return NON_WORD.matcher(name).replaceAll("");
    }

    public boolean isList() {
        return kind == StreamKind.RESPONSE_LIST;
    }
}
