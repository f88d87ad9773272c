package io.wgstools.transport.ftp;

/*
 * Copyright (c) wgstools
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.wgstools.api.CancellationToken;
import io.wgstools.api.TransferSession;
import io.wgstools.api.TransferSessionFactory;

/// Creates [FtpTransferSession]s sharing one set of settings and the run cancellation token.
public class FtpTransferSessionFactory implements TransferSessionFactory {
    private final FtpSettings settings;
    private final CancellationToken token;

    public FtpTransferSessionFactory(FtpSettings settings, CancellationToken token) {
        this.settings = settings;
        this.token = token;
    }

    @Override
    public TransferSession create() {
        return new FtpTransferSession(settings, token);
    }
}
