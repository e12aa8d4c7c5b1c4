package com.devicesim.core.engine;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.effect.ConditionalEffect;
import com.devicesim.core.effect.Effect;
import com.devicesim.core.effect.SetAttributeEffect;
import com.devicesim.core.effect.SetTrendEffect;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.ChangeKind;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.Trend;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies effects in order to a mutable instance. Guards of conditional effects see every
 * write made before them.
 */
public class EffectApplier {

    private final DefinitionCatalog catalog;
    private final ConditionEvaluator conditions;

    public EffectApplier(DefinitionCatalog catalog, ConditionEvaluator conditions) {
        this.catalog = catalog;
        this.conditions = conditions;
    }

    public void apply(List<Effect> effects, DeviceType type, DeviceInstance instance,
                      Map<String, String> parameters, EffectTrace trace) {
        for (Effect effect : effects) {
            apply(effect, type, instance, parameters, trace);
        }
    }

    private void apply(Effect effect, DeviceType type, DeviceInstance instance,
                       Map<String, String> parameters, EffectTrace trace) {
        if (effect instanceof SetAttributeEffect e) {
            setAttribute(e, type, instance, parameters, trace);
        } else if (effect instanceof SetTrendEffect e) {
            setTrend(e, instance, trace);
        } else if (effect instanceof ConditionalEffect e) {
            boolean guard = conditions.holds(e.condition(), type, instance, parameters);
            apply(guard ? e.thenEffects() : e.elseEffects(), type, instance, parameters, trace);
        } else {
            throw new IllegalStateException("Unhandled effect type: " + effect.getClass().getName());
        }
    }

    private void setAttribute(SetAttributeEffect e, DeviceType type, DeviceInstance instance,
                              Map<String, String> parameters, EffectTrace trace) {
        var attribute = instance.attribute(e.target());
        if (!attribute.spec().mutable()) {
            throw new EvaluationException("Attribute " + e.target() + " is not mutable");
        }
        String value = e.value().resolve(parameters).get(0);
        var domain = catalog.domainOf(type, e.target())
                .orElseThrow(() -> new EvaluationException("No value domain for attribute " + e.target()));
        if (!domain.contains(value)) {
            throw new EvaluationException("Value '" + value + "' is not valid for " + e.target()
                    + "; expected one of " + domain.levels());
        }
        String before = attribute.current();
        attribute.writeValue(value);
        trace.recordValue(e.target(), new AttributeChange(e.target().toString(), before, value, ChangeKind.VALUE));
    }

    private void setTrend(SetTrendEffect e, DeviceInstance instance, EffectTrace trace) {
        var attribute = instance.attribute(e.target());
        String valueBefore = attribute.current();
        Trend trendBefore = attribute.trend();
        attribute.writeTrend(e.direction());

        var recorded = new ArrayList<AttributeChange>();
        recorded.add(new AttributeChange(e.target().toString(), valueBefore, attribute.current(), ChangeKind.VALUE));
        recorded.add(new AttributeChange(e.target() + ".trend", trendBefore.wireName(),
                attribute.trend().wireName(), ChangeKind.TREND));
        trace.recordTrend(e.target(), recorded);
    }
}
