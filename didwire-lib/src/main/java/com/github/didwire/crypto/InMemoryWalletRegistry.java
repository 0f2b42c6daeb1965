// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.didwire.crypto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.github.didwire.DidwireLogger.LOGGER;

/// Keeps [LocalWallet]s in memory for the life of the process. Only a digest of the passphrase is held.
public class InMemoryWalletRegistry implements WalletRegistry {

  record Entry(LocalWallet wallet, byte[] passphraseDigest) {
  }

  private final Map<String, Entry> wallets = new ConcurrentHashMap<>();

  @Override
  public WalletCreation create(String name, String passphrase) {
    if (name == null || name.isBlank()) {
      return new WalletCreation.Failed(String.valueOf(name), new IllegalArgumentException("Wallet name cannot be blank"));
    }
    try {
      byte[] digest = digest(passphrase);
      Entry existing = wallets.putIfAbsent(name, new Entry(new LocalWallet(name), digest));
      if (existing != null) {
        LOGGER.fine(() -> "Wallet already exists: " + name);
        return new WalletCreation.AlreadyExists(name);
      }
      LOGGER.info(() -> "Created wallet " + name);
      return new WalletCreation.Created(name);
    } catch (NoSuchAlgorithmException e) {
      return new WalletCreation.Failed(name, e);
    }
  }

  @Override
  public Wallet open(String name, String passphrase) {
    Entry entry = wallets.get(name);
    if (entry == null) {
      throw new WalletUnavailableException("No such wallet: " + name);
    }
    if (!matches(entry, passphrase)) {
      throw new WalletUnavailableException("Wrong passphrase for wallet " + name);
    }
    LOGGER.fine(() -> "Opened wallet " + name);
    return entry.wallet().reopen();
  }

  @Override
  public boolean delete(String name, String passphrase) {
    Entry entry = wallets.get(name);
    if (entry == null) {
      return false;
    }
    if (!matches(entry, passphrase)) {
      throw new WalletUnavailableException("Wrong passphrase for wallet " + name);
    }
    entry.wallet().close();
    wallets.remove(name, entry);
    LOGGER.info(() -> "Deleted wallet " + name);
    return true;
  }

  private static boolean matches(Entry entry, String passphrase) {
    try {
      return MessageDigest.isEqual(entry.passphraseDigest(), digest(passphrase));
    } catch (NoSuchAlgorithmException e) {
      throw new WalletUnavailableException("Cannot check passphrase", e);
    }
  }

  private static byte[] digest(String passphrase) throws NoSuchAlgorithmException {
    return MessageDigest.getInstance("SHA-256").digest(String.valueOf(passphrase).getBytes(StandardCharsets.UTF_8));
  }
}
