package io.b2mash.formlogic.logic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TextResponse(@JsonProperty("text") String text) {}
