package com.myorg.scf.sidecar.crypto;

public enum KeyWrapAlgorithm {
    RSA,
    AES
}
