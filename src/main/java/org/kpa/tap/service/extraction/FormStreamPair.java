package org.kpa.tap.service.extraction;

import org.kpa.tap.models.dto.Form;

public record FormStreamPair(
        Form form,
        FormResponseStream list,
        FormResponseStream detail
) {
}
