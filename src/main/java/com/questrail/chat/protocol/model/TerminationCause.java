package com.questrail.chat.protocol.model;

/**
 * Why a session reached its terminal state.
 */
public enum TerminationCause
{
    USER_REQUEST,
    REMOTE_FAREWELL,
    REMOTE_ERROR,
    PROTOCOL_FAULT,
    CONNECTION_FAULT
}
