package com.tazifor.popup.trigger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tazifor.popup.model.LogicOperator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * The triggers of one campaign and how they combine (AND by default).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerConfig {

    private List<TriggerSpec> triggers;
    private LogicOperator operator;

    public static TriggerConfig of(LogicOperator operator, TriggerSpec... triggers) {
        return new TriggerConfig(List.of(triggers), operator);
    }

    @JsonIgnore
    public LogicOperator getEffectiveOperator() {
        return operator != null ? operator : LogicOperator.AND;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return triggers == null || triggers.isEmpty();
    }
}
