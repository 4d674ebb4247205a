package com.quick.trio.trio;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RevealView {
    private CardView card;
    private String source;
    private String sourceId;
    private HandPosition position;

    public static RevealView from(RevealEntry entry) {
        RevealView view = new RevealView();
        view.setCard(CardView.from(entry.card(), true));
        view.setSource(entry.sourceLabel());
        view.setSourceId(entry.origin().sourceId());
        view.setPosition(entry.origin().position());
        return view;
    }
}
