// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Capabilities the agent consumes and a reference wallet that provides them.
///
/// The agent sees keys only by their base58 verkey. [com.github.didwire.crypto.CryptoProvider] signs, verifies,
/// packs and unpacks; [com.github.didwire.crypto.IdentityStore] maps keys to DIDs and keeps pairwise
/// relationships. [com.github.didwire.crypto.LocalWallet] implements both over the JDK Ed25519, X25519 and
/// AES-GCM providers and [com.github.didwire.crypto.InMemoryWalletRegistry] manages named wallets.
package com.github.didwire.crypto;
