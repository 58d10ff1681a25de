/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tileverse.pixelreader;

/**
 * Thrown when a requested region is empty or extends past the edges of the image.
 */
public class InvalidRegionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final transient Region region;

    public InvalidRegionException(Region region, int imageWidth, int imageHeight) {
        super("Region %s is empty or outside the %dx%d image"
                .formatted(region, imageWidth, imageHeight));
        this.region = region;
    }

    public Region getRegion() {
        return region;
    }
}
