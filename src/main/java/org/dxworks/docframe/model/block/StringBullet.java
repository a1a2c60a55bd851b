package org.dxworks.docframe.model.block;

/**
 * Bullet format based on the character sequence used in the markup.
 */
public record StringBullet(String bullet) implements BulletFormat {
}
