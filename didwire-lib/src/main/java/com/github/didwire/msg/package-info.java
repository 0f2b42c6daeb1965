// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The message model.
///
/// - [com.github.didwire.msg.Message]: ordered JSON mapping with a `@type` and an attached unpack context
/// - [com.github.didwire.msg.MessageContext]: sender and recipient keys and DIDs known after unpacking
/// - [com.github.didwire.msg.MessageType]: parsed `<base-did>;spec/<family>/<version>/<name>` type URIs
/// - [com.github.didwire.msg.MessageSerializer]: Jackson based wire text conversion
package com.github.didwire.msg;
