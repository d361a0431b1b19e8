package com.appetite.kitchen.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TicketCreatedEvent extends TicketEventMetadata {
    @JsonProperty("status")
    private String status;

    @JsonProperty("quantity")
    private int quantity;

    @JsonProperty("notes")
    private String notes;
}
