package com.myorg.justelparser.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class References {

    @Builder.Default
    @JsonProperty("modifies")
    private List<ModificationRecord> modifies = List.of();

    @Builder.Default
    @JsonProperty("modified_by")
    private List<ModificationRecord> modifiedBy = List.of();

    public List<ModificationRecord> getModifies() {
        return modifies == null ? List.of() : List.copyOf(modifies);
    }

    public List<ModificationRecord> getModifiedBy() {
        return modifiedBy == null ? List.of() : List.copyOf(modifiedBy);
    }

    public static References empty() {
        return References.builder().build();
    }
}
