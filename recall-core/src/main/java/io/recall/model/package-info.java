/**
 * Value types shared by the stores, pipelines and graph sink.
 */
package io.recall.model;
