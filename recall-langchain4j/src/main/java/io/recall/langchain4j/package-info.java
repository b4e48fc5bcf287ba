/**
 * LangChain4j binding for the quality judge.
 */
package io.recall.langchain4j;
