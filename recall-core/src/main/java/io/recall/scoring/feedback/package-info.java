/**
 * Human feedback: the implicit reading of a user's reply and explicit feedback recording.
 */
package io.recall.scoring.feedback;
