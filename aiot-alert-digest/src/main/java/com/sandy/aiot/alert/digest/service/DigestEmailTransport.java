package com.sandy.aiot.alert.digest.service;

import com.sandy.aiot.alert.digest.vo.DigestEmail;

/**
 * Outbound email delivery. Returning normally means the transport accepted the message;
 * any exception is a failed delivery. Transport-level retries are the implementation's business.
 */
public interface DigestEmailTransport {
    void send(DigestEmail email) throws Exception;
}
