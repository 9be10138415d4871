package com.example.oncallrotation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Slash command reply in Slack's block format
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SlackCommandResponse {

    public static final String IN_CHANNEL = "in_channel";
    public static final String EPHEMERAL = "ephemeral";

    @JsonProperty("response_type")
    private String responseType;

    /**
     * Plain-text fallback, set for error replies
     */
    private String text;

    private List<Block> blocks;

    public static SlackCommandResponse inChannel(List<String> sections) {
        return new SlackCommandResponse(IN_CHANNEL, null, sections.stream().map(Block::section).toList());
    }

    public static SlackCommandResponse ephemeral(List<String> sections) {
        return new SlackCommandResponse(EPHEMERAL, null, sections.stream().map(Block::section).toList());
    }

    public static SlackCommandResponse error(String message) {
        return new SlackCommandResponse(EPHEMERAL, message, null);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Block {
        private String type;
        private Text text;

        static Block section(String markdown) {
            return new Block("section", new Text("mrkdwn", markdown));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Text {
        private String type;
        private String text;
    }
}
