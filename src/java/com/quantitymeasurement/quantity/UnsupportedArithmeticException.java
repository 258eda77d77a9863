// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.quantitymeasurement.quantity;

/**
 * Thrown when an arithmetic operation is requested on quantities whose category does not allow
 * it; eg: adding two absolute temperatures.
 */
public class UnsupportedArithmeticException extends UnsupportedOperationException {

  private final String operation;

  /**
   * @param category the name of the category that rejected the operation
   * @param operation the name of the rejected operation
   */
  public UnsupportedArithmeticException(String category, String operation) {
    super(String.format("%s units do not support %s operations. Only equality comparison and unit"
        + " conversion are supported for %s.", category, operation, category.toLowerCase()));
    this.operation = operation;
  }

  /**
   * Returns the name of the operation that was rejected.
   */
  public String getOperation() {
    return operation;
  }
}
