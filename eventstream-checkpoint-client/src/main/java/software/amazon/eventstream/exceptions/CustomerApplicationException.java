/*
 * Copyright 2024 Amazon.com, Inc. or its affiliates.
 * Licensed under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package software.amazon.eventstream.exceptions;

/**
 * Exception thrown when an application supplied partition lifecycle handler fails. The checkpoint lock state has
 * already been updated by the time this is raised.
 */
public class CustomerApplicationException extends Exception {
    private static final long serialVersionUID = 1L;

    public CustomerApplicationException(Throwable e) {
        super(e);
    }

    public CustomerApplicationException(String message, Throwable e) {
        super(message, e);
    }

    public CustomerApplicationException(String message) {
        super(message);
    }
}
