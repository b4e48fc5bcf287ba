/**
 * Spring transaction bridge.
 */
package io.recall.spring;
