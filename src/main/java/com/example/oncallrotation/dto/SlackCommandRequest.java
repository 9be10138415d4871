package com.example.oncallrotation.dto;

import com.example.oncallrotation.exception.InvalidInputException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.FormHttpMessageConverter;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.util.MultiValueMap;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Form fields Slack posts for a slash command
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlackCommandRequest {

    private static final FormHttpMessageConverter FORM_CONVERTER = new FormHttpMessageConverter();

    private String teamId;
    private String teamDomain;
    private String enterpriseId;
    private String enterpriseName;
    private boolean enterpriseInstall;
    private String channelId;
    private String channelName;
    private String userId;
    private String userName;
    private String command;
    private String text;
    private String responseUrl;

    /**
     * Parse an {@code application/x-www-form-urlencoded} body. Missing fields become empty strings.
     *
     * @throws InvalidInputException if the body is not valid form encoding
     */
    public static SlackCommandRequest fromForm(String body) {
        MultiValueMap<String, ?> params;
        try {
            params = FORM_CONVERTER.read(null, formMessage(body == null ? "" : body));
        } catch (IOException | IllegalArgumentException | HttpMessageConversionException e) {
            throw new InvalidInputException("body", "Malformed slash command request: " + e.getMessage());
        }

        return SlackCommandRequest.builder()
                .teamId(param(params, "team_id"))
                .teamDomain(param(params, "team_domain"))
                .enterpriseId(param(params, "enterprise_id"))
                .enterpriseName(param(params, "enterprise_name"))
                .enterpriseInstall("true".equalsIgnoreCase(param(params, "is_enterprise_install")))
                .channelId(param(params, "channel_id"))
                .channelName(param(params, "channel_name"))
                .userId(param(params, "user_id"))
                .userName(param(params, "user_name"))
                .command(param(params, "command"))
                .text(param(params, "text"))
                .responseUrl(param(params, "response_url"))
                .build();
    }

    private static HttpInputMessage formMessage(String body) {
        var headers = new HttpHeaders();
        headers.setContentType(new MediaType(MediaType.APPLICATION_FORM_URLENCODED, StandardCharsets.UTF_8));
        return new HttpInputMessage() {
            @Override
            public InputStream getBody() {
                return new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8));
            }

            @Override
            public HttpHeaders getHeaders() {
                return headers;
            }
        };
    }

    private static String param(MultiValueMap<String, ?> params, String name) {
        var value = params.getFirst(name);
        return value == null ? "" : value.toString();
    }
}
