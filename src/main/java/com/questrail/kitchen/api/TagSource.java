package com.questrail.kitchen.api;

/**
 * Where an item's effective route tags came from.
 */
public enum TagSource
{
    /** The item's own, non-empty tag set. */
    ITEM,
    /** The item had no own tags; its category's tags were used. */
    CATEGORY,
    /** Neither the item nor its category carry tags. */
    NONE
}
