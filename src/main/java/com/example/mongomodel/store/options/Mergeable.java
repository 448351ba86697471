package com.example.mongomodel.store.options;

/**
 * An option object that can be overlaid by another instance of its own type.
 * Fields set on the override win; fields left null keep the current value.
 */
public interface Mergeable<O extends Mergeable<O>> {

    O mergeWith(O override);
}
