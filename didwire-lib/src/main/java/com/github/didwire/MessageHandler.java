// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire;

import com.github.didwire.msg.Message;

import java.util.Optional;

@FunctionalInterface
public interface MessageHandler {
  Optional<Message> handle(Message message);
}
