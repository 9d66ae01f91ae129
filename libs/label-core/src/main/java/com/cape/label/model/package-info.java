/**
 * Value types of the label store. Entities reference each other by id only; junctions between
 * tokens and token-sets, and between levels and groups, live in the store.
 */
package com.cape.label.model;
