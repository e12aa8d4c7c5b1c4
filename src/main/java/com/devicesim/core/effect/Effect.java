package com.devicesim.core.effect;

import java.io.Serializable;

/**
 * State mutation performed by an action. Effects run in declared order and each write is
 * visible to the effects after it.
 */
public sealed interface Effect extends Serializable
        permits SetAttributeEffect, SetTrendEffect, ConditionalEffect {
}
